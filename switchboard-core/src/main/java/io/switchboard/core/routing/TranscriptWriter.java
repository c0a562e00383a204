package io.switchboard.core.routing;

import io.switchboard.core.conversation.ConversationStore;
import io.switchboard.core.fanout.MessageEvent;
import io.switchboard.core.fanout.RealtimeFanout;
import io.switchboard.core.model.ChatMessage;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.MessageOrigin;
import io.switchboard.core.model.QuickReply;
import io.switchboard.core.model.TranscriptMessage;
import io.switchboard.core.transcript.MarkdownDetector;
import io.switchboard.core.transcript.TranscriptStore;
import io.switchboard.core.transcript.TranscriptWindow;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transcript writes shared by both routers: each write is followed by a
 * broadcast, and replies are dropped when the conversation closed meanwhile.
 */
final class TranscriptWriter {
    private static final Logger LOG = LoggerFactory.getLogger(TranscriptWriter.class);

    private final ConversationStore conversations;
    private final TranscriptStore transcripts;
    private final RealtimeFanout fanout;

    TranscriptWriter(ConversationStore conversations, TranscriptStore transcripts, RealtimeFanout fanout) {
        this.conversations = conversations;
        this.transcripts = transcripts;
        this.fanout = fanout;
    }

    TranscriptMessage appendAndPublish(TranscriptMessage draft) throws IOException {
        TranscriptMessage stored = transcripts.append(draft);
        publish(stored, List.of());
        return stored;
    }

    /**
     * Appends a system-authored message unless the conversation has been
     * closed or deleted since the flow started. Returns null when dropped.
     */
    TranscriptMessage appendIfOpen(String conversationId, String content, boolean sentExternally, String externalMessageId)
        throws IOException {
        Optional<Conversation> current = conversations.find(conversationId);
        if (current.isEmpty() || current.get().isClosed()) {
            LOG.info("Conversation {} closed before the pending message was written; discarding it", conversationId);
            return null;
        }
        return appendAndPublish(TranscriptMessage.draft(
            conversationId,
            content,
            MessageOrigin.LOCAL_SYSTEM,
            MarkdownDetector.isMarkdown(content),
            sentExternally,
            externalMessageId
        ));
    }

    void publish(TranscriptMessage message, List<QuickReply> quickReplies) {
        try {
            fanout.broadcast(new MessageEvent(message.conversationId(), message, quickReplies));
        } catch (RuntimeException e) {
            LOG.warn("Broadcast of message {} failed", message.id(), e);
        }
    }

    /**
     * The last {@code limit} entries before {@code current}, as chat history.
     */
    List<ChatMessage> historyBefore(TranscriptMessage current, int limit) throws IOException {
        List<TranscriptMessage> window = transcripts.recent(current.conversationId(), limit + 1).stream()
            .filter(message -> !message.id().equals(current.id()))
            .toList();
        if (window.size() > limit) {
            window = window.subList(window.size() - limit, window.size());
        }
        return TranscriptWindow.toChatHistory(window);
    }

    List<ChatMessage> fullHistoryBefore(TranscriptMessage current) throws IOException {
        List<TranscriptMessage> all = transcripts.listByConversation(current.conversationId()).stream()
            .filter(message -> !message.id().equals(current.id()))
            .toList();
        return TranscriptWindow.toChatHistory(all);
    }
}
