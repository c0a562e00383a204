package io.switchboard.core.correlation;

public record ExternalSession(String conversationId, String sessionId, boolean active) {
}
