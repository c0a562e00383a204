package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SwitchboardConfig(
    ServerConfig server,
    StorageConfig storage,
    LlmConfig llm,
    ProvidersConfig providers,
    GenesysConfig genesys,
    RoutingConfig routing,
    MemoryConfig memory,
    PromptsConfig prompts
) {

    public static SwitchboardConfig defaults() {
        return new SwitchboardConfig(
            ServerConfig.defaults(),
            StorageConfig.defaults(),
            LlmConfig.defaults(),
            ProvidersConfig.defaults(),
            GenesysConfig.defaults(),
            RoutingConfig.defaults(),
            MemoryConfig.defaults(),
            PromptsConfig.defaults()
        );
    }

    public SwitchboardConfig withProviders(ProvidersConfig providers) {
        return new SwitchboardConfig(server, storage, llm, providers, genesys, routing, memory, prompts);
    }

    public SwitchboardConfig withGenesys(GenesysConfig genesys) {
        return new SwitchboardConfig(server, storage, llm, providers, genesys, routing, memory, prompts);
    }

    public SwitchboardConfig withServer(ServerConfig server) {
        return new SwitchboardConfig(server, storage, llm, providers, genesys, routing, memory, prompts);
    }
}
