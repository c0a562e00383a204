package io.switchboard.core.correlation;

import io.switchboard.core.conversation.ConversationStore;
import io.switchboard.core.error.ConversationClosedException;
import io.switchboard.core.error.ConversationNotFoundException;
import io.switchboard.core.model.Conversation;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps conversations to live-agent sessions. The mapping lives on the
 * conversation row; this class only decides when to create it and how to
 * read it back from an inbound address.
 */
public final class CorrelationRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(CorrelationRegistry.class);

    private final ConversationStore conversations;
    private final Supplier<String> sessionIds;

    public CorrelationRegistry(ConversationStore conversations) {
        this(conversations, () -> UUID.randomUUID().toString());
    }

    public CorrelationRegistry(ConversationStore conversations, Supplier<String> sessionIds) {
        this.conversations = conversations;
        this.sessionIds = sessionIds;
    }

    /**
     * Returns the existing session or creates one. Creation is a single
     * conditional write, so concurrent callers converge on the same id.
     * Closed conversations never get a session.
     */
    public ExternalSession ensureSession(String conversationId) throws IOException {
        Conversation conversation = require(conversationId);
        if (conversation.isClosed()) {
            throw new ConversationClosedException(conversationId);
        }
        if (conversation.hasExternalSession()) {
            return toSession(conversation);
        }
        String candidate = sessionIds.get();
        if (conversations.assignExternalSession(conversationId, candidate)) {
            LOG.info("Opened external session {} for conversation {}", candidate, conversationId);
        }
        return toSession(require(conversationId));
    }

    /**
     * Operator switch for live-agent forwarding. While off, customer messages
     * are answered locally and agent events are refused.
     */
    public void setForwarding(String conversationId, boolean active) throws IOException {
        if (!conversations.setExternalActive(conversationId, active)) {
            throw new ConversationNotFoundException(conversationId);
        }
        LOG.info("Live agent forwarding for conversation {} switched {}", conversationId, active ? "on" : "off");
    }

    public Optional<ExternalSession> activeSession(String conversationId) throws IOException {
        return conversations.find(conversationId)
            .filter(Conversation::hasActiveExternalSession)
            .map(this::toSession);
    }

    public AddressTag resolve(String addressToken) {
        return AddressTag.decode(addressToken);
    }

    public String addressFor(String conversationId, String ownerAddress) {
        return AddressTag.encode(conversationId, ownerAddress);
    }

    private Conversation require(String conversationId) throws IOException {
        return conversations.find(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    private ExternalSession toSession(Conversation conversation) {
        return new ExternalSession(conversation.id(), conversation.externalSessionId(), conversation.externalActive());
    }
}
