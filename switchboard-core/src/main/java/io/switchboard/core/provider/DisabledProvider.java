package io.switchboard.core.provider;

import io.switchboard.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Stands in for a provider without credentials. Always answers with an error
 * response so fallback chains move on to the next provider.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools, ChatOptions options) {
        return new LlmResponse(
            LlmResponse.ERROR_PREFIX + " provider " + name + " is not configured (" + reason + ")",
            List.of(),
            Map.of("provider", name, "disabled", true)
        );
    }
}
