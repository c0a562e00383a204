package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Optional prompt override files. Blank entries keep the built-in prompt.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptsConfig(
    String routing,
    @JsonAlias({"external_response"}) String externalResponse,
    @JsonAlias({"memory_extraction"}) String memoryExtraction,
    String reply
) {

    public static PromptsConfig defaults() {
        return new PromptsConfig("", "", "", "");
    }
}
