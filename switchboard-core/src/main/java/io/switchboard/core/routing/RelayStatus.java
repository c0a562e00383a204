package io.switchboard.core.routing;

public enum RelayStatus {
    PROCESSED,
    DUPLICATE,
    IGNORED
}
