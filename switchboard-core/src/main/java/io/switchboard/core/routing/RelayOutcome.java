package io.switchboard.core.routing;

public record RelayOutcome(RelayStatus status, String conversationId) {

    static RelayOutcome processed(String conversationId) {
        return new RelayOutcome(RelayStatus.PROCESSED, conversationId);
    }

    static RelayOutcome duplicate(String conversationId) {
        return new RelayOutcome(RelayStatus.DUPLICATE, conversationId);
    }

    static RelayOutcome ignored(String conversationId) {
        return new RelayOutcome(RelayStatus.IGNORED, conversationId);
    }
}
