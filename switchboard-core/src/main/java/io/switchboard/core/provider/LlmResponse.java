package io.switchboard.core.provider;

import io.switchboard.core.model.ToolCall;
import java.util.List;
import java.util.Map;

/**
 * Result of one completion. Providers never throw for transport or API
 * failures; they return content prefixed with {@link #ERROR_PREFIX} instead.
 */
public record LlmResponse(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM:";

    public LlmResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmResponse error(String detail) {
        return new LlmResponse(ERROR_PREFIX + " " + detail, List.of(), Map.of());
    }

    public boolean isError() {
        return content.startsWith(ERROR_PREFIX);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
