package io.switchboard.core.error;

public final class UnauthorizedException extends RelayException {

    public UnauthorizedException(String message) {
        super("unauthorized", 401, message);
    }
}
