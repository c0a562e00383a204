package io.switchboard.core.transcript;

import io.switchboard.core.model.ChatMessage;
import io.switchboard.core.model.TranscriptMessage;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps transcript entries to LLM chat history. Live-agent messages are
 * presented as user turns with a speaker prefix so the model can tell them
 * apart from the customer.
 */
public final class TranscriptWindow {
    public static final String LIVE_AGENT_PREFIX = "Live agent: ";

    private TranscriptWindow() {
    }

    public static List<ChatMessage> toChatHistory(List<TranscriptMessage> messages) {
        List<ChatMessage> history = new ArrayList<>(messages.size());
        for (TranscriptMessage message : messages) {
            history.add(switch (message.origin()) {
                case USER -> ChatMessage.user(message.content());
                case LOCAL_SYSTEM -> ChatMessage.assistant(message.content());
                case EXTERNAL_SYSTEM -> ChatMessage.user(LIVE_AGENT_PREFIX + message.content());
            });
        }
        return history;
    }
}
