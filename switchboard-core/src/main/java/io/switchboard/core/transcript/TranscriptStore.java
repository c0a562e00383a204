package io.switchboard.core.transcript;

import io.switchboard.core.model.TranscriptMessage;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface TranscriptStore {
    /**
     * Persists a draft and returns it with id, timestamp and sequence assigned.
     */
    TranscriptMessage append(TranscriptMessage draft) throws IOException;

    /**
     * Persists an entry received from the live-agent platform unless one with
     * the same external message id already exists in that conversation.
     */
    Optional<TranscriptMessage> appendExternalEvent(TranscriptMessage draft) throws IOException;

    List<TranscriptMessage> listByConversation(String conversationId) throws IOException;

    /**
     * The last {@code limit} entries of a conversation, oldest first.
     */
    List<TranscriptMessage> recent(String conversationId, int limit) throws IOException;

    /**
     * Latest entry per conversation of the given owner, keyed by conversation id.
     * Conversations without messages are absent.
     */
    Map<String, TranscriptMessage> latestPerConversation(String ownerId) throws IOException;
}
