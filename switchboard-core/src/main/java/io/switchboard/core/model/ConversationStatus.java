package io.switchboard.core.model;

public enum ConversationStatus {
    OPEN,
    CLOSED
}
