package io.switchboard.core.routing;

import io.switchboard.core.correlation.AddressTag;
import io.switchboard.core.correlation.CorrelationRegistry;
import io.switchboard.core.correlation.ExternalSession;
import io.switchboard.core.error.ConversationClosedException;
import io.switchboard.core.error.ConversationNotFoundException;
import io.switchboard.core.error.NoActiveSessionException;
import io.switchboard.core.error.OwnershipMismatchException;
import io.switchboard.core.error.RelayException;
import io.switchboard.core.external.ExternalForwarder;
import io.switchboard.core.external.ExternalSendResult;
import io.switchboard.core.external.VendorEvent;
import io.switchboard.core.external.VendorEventParser;
import io.switchboard.core.fanout.RealtimeFanout;
import io.switchboard.core.model.ChatMessage;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.MessageOrigin;
import io.switchboard.core.model.Owner;
import io.switchboard.core.model.TranscriptMessage;
import io.switchboard.core.oracle.DecisionOracle;
import io.switchboard.core.oracle.ExternalResponseDecision;
import io.switchboard.core.transcript.MarkdownDetector;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Handles webhook events from the live-agent platform: finds the
 * conversation from the tagged recipient address, records the agent's text
 * once per event id, then lets the oracle answer the agent, ask the
 * customer, or both.
 */
public final class OutboundRelay {
    private static final Logger LOG = LoggerFactory.getLogger(OutboundRelay.class);
    private static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");

    private final RelayStores stores;
    private final VendorEventParser parser;
    private final DecisionOracle oracle;
    private final CorrelationRegistry registry;
    private final ExternalForwarder forwarder;
    private final TranscriptWriter writer;
    private final RelaySettings settings;

    public OutboundRelay(
        RelayStores stores,
        VendorEventParser parser,
        DecisionOracle oracle,
        CorrelationRegistry registry,
        ExternalForwarder forwarder,
        RealtimeFanout fanout,
        RelaySettings settings
    ) {
        this.stores = stores;
        this.parser = parser;
        this.oracle = oracle;
        this.registry = registry;
        this.forwarder = forwarder;
        this.writer = new TranscriptWriter(stores.conversations(), stores.transcripts(), fanout);
        this.settings = settings;
    }

    public RelayOutcome handleExternalEvent(String rawPayload) throws IOException {
        VendorEvent event = parser.parse(rawPayload);
        if (!event.isRelayable()) {
            LOG.debug("Ignoring {} event {} (direction {})", event.kind(), event.eventId(), event.direction());
            return RelayOutcome.ignored(null);
        }

        AddressTag tag = registry.resolve(event.recipientAddress());
        String conversationId = tag.conversationId();
        Conversation conversation = stores.conversations().find(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        Owner owner = verifyOwner(conversation, tag);

        if (conversation.isClosed()) {
            LOG.info("Conversation {} is closed; ignoring live agent event {}", conversationId, event.eventId());
            return RelayOutcome.ignored(conversationId);
        }
        if (!conversation.hasActiveExternalSession()) {
            throw new NoActiveSessionException(conversationId);
        }

        Optional<TranscriptMessage> stored = stores.transcripts().appendExternalEvent(TranscriptMessage.draft(
            conversationId,
            event.text(),
            MessageOrigin.EXTERNAL_SYSTEM,
            MarkdownDetector.isMarkdown(event.text()),
            true,
            event.eventId()
        ));
        if (stored.isEmpty()) {
            LOG.info("Live agent event {} for conversation {} was already recorded", event.eventId(), conversationId);
            return RelayOutcome.duplicate(conversationId);
        }
        writer.publish(stored.get(), event.quickReplies());

        List<ChatMessage> history = writer.historyBefore(stored.get(), settings.historyWindow());
        String ownerContext = stores.memories().formatContext(conversationId);
        ExternalResponseDecision decision = decide(event.text(), history, ownerContext);

        if (decision.replyToExternal() && decision.hasExternalText()) {
            replyToAgent(conversationId, owner, decision.externalText());
        }
        if (decision.askUser() && decision.hasUserQuestion()) {
            askCustomer(conversationId, decision.userQuestion());
        }
        return RelayOutcome.processed(conversationId);
    }

    private Owner verifyOwner(Conversation conversation, AddressTag tag) throws IOException {
        Optional<Owner> owner = stores.owners().findById(conversation.ownerId());
        String expected = owner.map(o -> o.email().toLowerCase(Locale.ROOT)).orElse("");
        if (!expected.equals(tag.baseAddress().toLowerCase(Locale.ROOT))) {
            LOG.warn(
                SECURITY,
                "Rejected live agent event for conversation {}: address {} does not belong to its owner",
                conversation.id(),
                tag.baseAddress()
            );
            throw new OwnershipMismatchException(conversation.id());
        }
        return owner.get();
    }

    private ExternalResponseDecision decide(String agentText, List<ChatMessage> history, String ownerContext) {
        try {
            return oracle.decideExternalResponse(agentText, history, ownerContext);
        } catch (RuntimeException e) {
            LOG.error("External response oracle failed", e);
            return ExternalResponseDecision.fallback(agentText, "oracle error");
        }
    }

    private void replyToAgent(String conversationId, Owner owner, String text) {
        try {
            ExternalSession session = registry.ensureSession(conversationId);
            if (!session.active()) {
                LOG.info("Live agent forwarding was switched off for conversation {}; reply not sent", conversationId);
                return;
            }
            String toAddress = registry.addressFor(conversationId, owner.email());
            ExternalSendResult result = forwarder.send(settings.fromAddress(), toAddress, text, session);
            writer.appendIfOpen(conversationId, text, true, result.externalMessageId());
        } catch (ConversationClosedException e) {
            LOG.info("Conversation {} closed before the reply went out; nothing sent to the live agent", conversationId);
        } catch (IOException | RelayException e) {
            LOG.warn("Replying to the live agent for conversation {} failed: {}", conversationId, e.getMessage(), e);
        }
    }

    private void askCustomer(String conversationId, String question) {
        try {
            writer.appendIfOpen(conversationId, question, false, null);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Asking the customer in conversation {} failed", conversationId, e);
        }
    }
}
