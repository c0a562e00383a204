package io.switchboard.core.fanout;

import io.switchboard.core.model.QuickReply;
import io.switchboard.core.model.TranscriptMessage;
import java.util.List;

public record MessageEvent(String conversationId, TranscriptMessage message, List<QuickReply> quickReplies) {
    public static final String TYPE = "new_message";

    public MessageEvent {
        quickReplies = quickReplies == null ? List.of() : List.copyOf(quickReplies);
    }

    public static MessageEvent of(TranscriptMessage message) {
        return new MessageEvent(message.conversationId(), message, List.of());
    }
}
