package io.switchboard.core.conversation;

import io.switchboard.core.model.Conversation;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ConversationStore {
    Conversation create(String ownerId, String title) throws IOException;

    Optional<Conversation> find(String conversationId) throws IOException;

    List<Conversation> listByOwner(String ownerId) throws IOException;

    /**
     * Marks the conversation CLOSED. Returns false when it was already closed
     * or does not exist.
     */
    boolean close(String conversationId) throws IOException;

    /**
     * Stores the external session id only when none is set yet. Returns true
     * when this call performed the assignment.
     */
    boolean assignExternalSession(String conversationId, String externalSessionId) throws IOException;

    /**
     * Switches live-agent forwarding on or off for one conversation. The
     * session id, if any, is kept. Returns false when the conversation does
     * not exist.
     */
    boolean setExternalActive(String conversationId, boolean active) throws IOException;

    /**
     * Deletes the conversation together with its messages and memories.
     */
    boolean delete(String conversationId) throws IOException;
}
