package io.switchboard.core.routing;

import io.switchboard.core.correlation.CorrelationRegistry;
import io.switchboard.core.correlation.ExternalSession;
import io.switchboard.core.error.ConversationClosedException;
import io.switchboard.core.error.ConversationNotFoundException;
import io.switchboard.core.error.RelayException;
import io.switchboard.core.external.ExternalForwarder;
import io.switchboard.core.external.ExternalSendResult;
import io.switchboard.core.fanout.RealtimeFanout;
import io.switchboard.core.memory.MemoryExtractor;
import io.switchboard.core.model.ChatMessage;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.MemoryEntry;
import io.switchboard.core.model.MessageOrigin;
import io.switchboard.core.model.TranscriptMessage;
import io.switchboard.core.oracle.DecisionOracle;
import io.switchboard.core.oracle.ReplyComposer;
import io.switchboard.core.oracle.RoutingDecision;
import io.switchboard.core.tool.ToolContext;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles a message typed by the customer: records it, asks the oracle where
 * it should go, then forwards it to the live agent, answers the customer, or
 * both. The customer always gets a reply unless the conversation is closed.
 */
public final class InboundRouter {
    private static final Logger LOG = LoggerFactory.getLogger(InboundRouter.class);

    private final RelayStores stores;
    private final DecisionOracle oracle;
    private final ReplyComposer replyComposer;
    private final MemoryExtractor memoryExtractor;
    private final CorrelationRegistry registry;
    private final ExternalForwarder forwarder;
    private final TranscriptWriter writer;
    private final RelaySettings settings;

    public InboundRouter(
        RelayStores stores,
        DecisionOracle oracle,
        ReplyComposer replyComposer,
        MemoryExtractor memoryExtractor,
        CorrelationRegistry registry,
        ExternalForwarder forwarder,
        RealtimeFanout fanout,
        RelaySettings settings
    ) {
        this.stores = stores;
        this.oracle = oracle;
        this.replyComposer = replyComposer;
        this.memoryExtractor = memoryExtractor;
        this.registry = registry;
        this.forwarder = forwarder;
        this.writer = new TranscriptWriter(stores.conversations(), stores.transcripts(), fanout);
        this.settings = settings;
    }

    public InboundOutcome handleUserMessage(String conversationId, String text, String ownerAddress) throws IOException {
        Conversation conversation = stores.conversations().find(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        if (conversation.isClosed()) {
            LOG.info("Conversation {} is closed; ignoring customer message", conversationId);
            return InboundOutcome.closed(conversationId);
        }

        TranscriptMessage userMessage = writer.appendAndPublish(
            TranscriptMessage.draft(conversationId, text, MessageOrigin.USER, false, false, null)
        );
        List<ChatMessage> history = writer.historyBefore(userMessage, settings.historyWindow());

        extractMemory(conversationId, text, history);
        List<String> memories = stores.memories().list(conversationId).stream()
            .map(MemoryEntry::content)
            .toList();

        RoutingDecision decision = decide(text, history, memories, conversation.hasActiveExternalSession());

        TranscriptMessage forwarded = null;
        if (decision.forwardToExternal() && decision.hasExternalText()) {
            Optional<TranscriptMessage> sent = forward(conversationId, decision.externalText(), ownerAddress);
            if (sent.isEmpty()) {
                decision = decision.withRespondToUser();
            } else {
                forwarded = sent.get();
            }
        } else if (decision.forwardToExternal()) {
            LOG.warn("Oracle asked to forward conversation {} but gave no text", conversationId);
        }

        if (!decision.respondToUser()) {
            return new InboundOutcome(conversationId, userMessage, forwarded, null, decision);
        }

        String replyText = decision.hasUserText()
            ? decision.userText()
            : replyComposer.compose(
                text,
                writer.fullHistoryBefore(userMessage),
                memories,
                new ToolContext(conversationId, ownerAddress, Map.of("correlationRegistry", registry))
            );
        TranscriptMessage reply = writer.appendIfOpen(conversationId, replyText, false, null);
        return new InboundOutcome(conversationId, userMessage, forwarded, reply, decision);
    }

    private void extractMemory(String conversationId, String text, List<ChatMessage> history) {
        try {
            Optional<String> memory = memoryExtractor.extract(text, history);
            if (memory.isPresent()) {
                stores.memories().remember(conversationId, memory.get());
                LOG.info("Stored memory for conversation {}", conversationId);
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Memory extraction failed for conversation {}", conversationId, e);
        }
    }

    private RoutingDecision decide(String text, List<ChatMessage> history, List<String> memories, boolean sessionActive) {
        try {
            return oracle.decideRouting(text, history, memories, sessionActive);
        } catch (RuntimeException e) {
            LOG.error("Routing oracle failed", e);
            return RoutingDecision.fallback("oracle error");
        }
    }

    /**
     * Sends first and records afterwards, so a failed send leaves nothing in
     * the transcript. An empty result means the customer must be answered
     * locally.
     */
    private Optional<TranscriptMessage> forward(String conversationId, String externalText, String ownerAddress) {
        try {
            ExternalSession session = registry.ensureSession(conversationId);
            if (!session.active()) {
                LOG.info("Live agent integration is switched off for conversation {}", conversationId);
                return Optional.empty();
            }
            String toAddress = registry.addressFor(conversationId, ownerAddress);
            ExternalSendResult result = forwarder.send(settings.fromAddress(), toAddress, externalText, session);
            return Optional.ofNullable(writer.appendIfOpen(conversationId, externalText, true, result.externalMessageId()));
        } catch (ConversationClosedException e) {
            LOG.info("Conversation {} closed before forwarding; nothing sent to the live agent", conversationId);
            return Optional.empty();
        } catch (IOException | RelayException e) {
            LOG.warn("Forwarding conversation {} to the live agent failed: {}", conversationId, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
