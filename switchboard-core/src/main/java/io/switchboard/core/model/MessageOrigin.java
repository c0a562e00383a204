package io.switchboard.core.model;

/**
 * Who produced a transcript entry.
 */
public enum MessageOrigin {
    /** Typed by the conversation owner. */
    USER,
    /** Generated by the relay itself, either for the user or for the live agent. */
    LOCAL_SYSTEM,
    /** Received from the live-agent platform. */
    EXTERNAL_SYSTEM
}
