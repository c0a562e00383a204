package io.switchboard.core.provider;

import io.switchboard.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools, ChatOptions options);

    default LlmResponse chat(String model, List<ChatMessage> messages) {
        return chat(model, messages, List.of(), ChatOptions.defaults());
    }
}
