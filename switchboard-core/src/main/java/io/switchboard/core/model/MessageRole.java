package io.switchboard.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
