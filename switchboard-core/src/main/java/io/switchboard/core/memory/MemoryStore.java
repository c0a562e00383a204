package io.switchboard.core.memory;

import io.switchboard.core.model.MemoryEntry;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface MemoryStore {
    /**
     * Stores a fact for the conversation. Content equal to an existing entry,
     * ignoring case and surrounding whitespace, returns that entry instead.
     */
    MemoryEntry remember(String conversationId, String content) throws IOException;

    List<MemoryEntry> list(String conversationId) throws IOException;

    Optional<MemoryEntry> find(String id) throws IOException;

    boolean forget(String id) throws IOException;

    /**
     * Bullet list of the conversation's memories, or an empty string.
     */
    default String formatContext(String conversationId) throws IOException {
        return format(list(conversationId));
    }

    static String format(List<MemoryEntry> entries) {
        StringBuilder out = new StringBuilder();
        for (MemoryEntry entry : entries) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append("- ").append(entry.content());
        }
        return out.toString();
    }
}
