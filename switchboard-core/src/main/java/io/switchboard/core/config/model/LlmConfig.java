package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * @param providerChain providers tried in order until one answers
 * @param model         model for routing decisions and memory extraction
 * @param replyModel    model for composed customer replies
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmConfig(
    @JsonAlias({"provider_chain"}) List<String> providerChain,
    String model,
    @JsonAlias({"reply_model"}) String replyModel,
    double temperature
) {

    public static LlmConfig defaults() {
        return new LlmConfig(List.of("openai", "openrouter"), "gpt-4o", "gpt-4o", 0.3);
    }
}
