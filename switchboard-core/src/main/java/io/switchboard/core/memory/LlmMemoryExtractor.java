package io.switchboard.core.memory;

import io.switchboard.core.model.ChatMessage;
import io.switchboard.core.oracle.OraclePrompts;
import io.switchboard.core.provider.ChatOptions;
import io.switchboard.core.provider.LlmProvider;
import io.switchboard.core.provider.LlmResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmMemoryExtractor implements MemoryExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(LlmMemoryExtractor.class);
    static final String NO_MEMORY = "NO_MEMORY";

    private final LlmProvider provider;
    private final String model;
    private final OraclePrompts prompts;

    public LlmMemoryExtractor(LlmProvider provider, String model, OraclePrompts prompts) {
        this.provider = provider;
        this.model = model;
        this.prompts = prompts;
    }

    @Override
    public Optional<String> extract(String userText, List<ChatMessage> recentHistory) {
        if (userText == null || userText.isBlank()) {
            return Optional.empty();
        }
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(prompts.memoryExtraction(userText)));
        messages.addAll(recentHistory);
        messages.add(ChatMessage.user(userText));

        LlmResponse response = provider.chat(model, messages, List.of(), new ChatOptions(0.3, 200, false));
        if (response.isError()) {
            LOG.warn("Memory extraction failed: {}", response.content());
            return Optional.empty();
        }
        String content = unquote(response.content().trim());
        if (content.isEmpty() || content.equalsIgnoreCase(NO_MEMORY)) {
            return Optional.empty();
        }
        return Optional.of(content);
    }

    private String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }
}
