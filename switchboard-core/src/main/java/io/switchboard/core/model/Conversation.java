package io.switchboard.core.model;

import java.time.Instant;
import java.util.Objects;

public record Conversation(
    String id,
    String ownerId,
    String title,
    ConversationStatus status,
    String externalSessionId,
    boolean externalActive,
    Instant createdAt,
    Instant updatedAt
) {

    public Conversation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        status = status == null ? ConversationStatus.OPEN : status;
    }

    public boolean isClosed() {
        return status == ConversationStatus.CLOSED;
    }

    public boolean hasExternalSession() {
        return externalSessionId != null && !externalSessionId.isBlank();
    }

    public boolean hasActiveExternalSession() {
        return externalActive && hasExternalSession();
    }
}
