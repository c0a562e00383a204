package io.switchboard.core.model;

import java.time.Instant;

public record MemoryEntry(
    String id,
    String conversationId,
    String content,
    Instant createdAt,
    Instant updatedAt
) {
}
