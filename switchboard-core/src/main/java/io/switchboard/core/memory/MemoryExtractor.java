package io.switchboard.core.memory;

import io.switchboard.core.model.ChatMessage;
import java.util.List;
import java.util.Optional;

/**
 * Picks out a durable fact worth remembering from a customer message.
 */
public interface MemoryExtractor {
    Optional<String> extract(String userText, List<ChatMessage> recentHistory);

    static MemoryExtractor disabled() {
        return (userText, recentHistory) -> Optional.empty();
    }
}
