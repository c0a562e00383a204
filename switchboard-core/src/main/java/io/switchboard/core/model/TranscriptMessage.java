package io.switchboard.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One persisted transcript entry. Entries are append-only and ordered by
 * {@link #createdAt()} with {@link #sequence()} breaking ties.
 */
public record TranscriptMessage(
    String id,
    String conversationId,
    String content,
    MessageOrigin origin,
    boolean markdown,
    boolean sentExternally,
    String externalMessageId,
    Instant createdAt,
    long sequence
) {

    public TranscriptMessage {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        content = content == null ? "" : content;
    }

    /**
     * A not-yet-persisted entry; the store assigns id, timestamp and sequence.
     */
    public static TranscriptMessage draft(
        String conversationId,
        String content,
        MessageOrigin origin,
        boolean markdown,
        boolean sentExternally,
        String externalMessageId
    ) {
        return new TranscriptMessage(null, conversationId, content, origin, markdown, sentExternally, externalMessageId, null, 0L);
    }

    /**
     * Styling hint used by chat clients: {@code user}, {@code system},
     * {@code system_to_external} or {@code external}.
     */
    public String displayType() {
        return switch (origin) {
            case USER -> "user";
            case EXTERNAL_SYSTEM -> "external";
            case LOCAL_SYSTEM -> sentExternally ? "system_to_external" : "system";
        };
    }
}
