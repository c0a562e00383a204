package io.switchboard.core.routing;

import io.switchboard.core.model.TranscriptMessage;
import io.switchboard.core.oracle.RoutingDecision;
import java.util.ArrayList;
import java.util.List;

/**
 * Messages written while handling one customer message. Everything is null
 * when the conversation was already closed.
 */
public record InboundOutcome(
    String conversationId,
    TranscriptMessage userMessage,
    TranscriptMessage forwardedMessage,
    TranscriptMessage replyMessage,
    RoutingDecision decision
) {

    static InboundOutcome closed(String conversationId) {
        return new InboundOutcome(conversationId, null, null, null, null);
    }

    public boolean accepted() {
        return userMessage != null;
    }

    public List<TranscriptMessage> messages() {
        List<TranscriptMessage> messages = new ArrayList<>(3);
        if (userMessage != null) {
            messages.add(userMessage);
        }
        if (forwardedMessage != null) {
            messages.add(forwardedMessage);
        }
        if (replyMessage != null) {
            messages.add(replyMessage);
        }
        return messages;
    }
}
