package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(ProviderConfig openai, ProviderConfig openrouter) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(ProviderConfig.defaults(), ProviderConfig.defaults());
    }
}
