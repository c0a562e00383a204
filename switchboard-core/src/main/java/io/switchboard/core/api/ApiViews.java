package io.switchboard.core.api;

import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.MemoryEntry;
import io.switchboard.core.model.QuickReply;
import io.switchboard.core.model.TranscriptMessage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON shapes shared by the HTTP routes and the realtime channel.
 */
final class ApiViews {

    private ApiViews() {
    }

    static Map<String, Object> conversation(Conversation conversation) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", conversation.id());
        view.put("title", conversation.title());
        view.put("status", conversation.status().name().toLowerCase(Locale.ROOT));
        view.put("external_session_id", conversation.externalSessionId());
        view.put("external_active", conversation.hasActiveExternalSession());
        view.put("created_at", timestamp(conversation.createdAt()));
        view.put("updated_at", timestamp(conversation.updatedAt()));
        return view;
    }

    static Map<String, Object> message(TranscriptMessage message) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", message.id());
        view.put("conversation_id", message.conversationId());
        view.put("content", message.content());
        view.put("origin", message.origin().name().toLowerCase(Locale.ROOT));
        view.put("type", message.displayType());
        view.put("markdown", message.markdown());
        view.put("sent_externally", message.sentExternally());
        view.put("external_message_id", message.externalMessageId());
        view.put("created_at", timestamp(message.createdAt()));
        view.put("sequence", message.sequence());
        return view;
    }

    static List<Map<String, Object>> messages(List<TranscriptMessage> messages) {
        List<Map<String, Object>> views = new ArrayList<>(messages.size());
        for (TranscriptMessage message : messages) {
            views.add(message(message));
        }
        return views;
    }

    static Map<String, Object> memory(MemoryEntry entry) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", entry.id());
        view.put("conversation_id", entry.conversationId());
        view.put("content", entry.content());
        view.put("created_at", timestamp(entry.createdAt()));
        view.put("updated_at", timestamp(entry.updatedAt()));
        return view;
    }

    static List<Map<String, String>> quickReplies(List<QuickReply> replies) {
        List<Map<String, String>> views = new ArrayList<>(replies.size());
        for (QuickReply reply : replies) {
            Map<String, String> view = new LinkedHashMap<>();
            view.put("text", reply.text());
            view.put("payload", reply.payload());
            views.add(view);
        }
        return views;
    }

    private static String timestamp(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
