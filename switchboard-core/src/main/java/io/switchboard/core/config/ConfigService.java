package io.switchboard.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.switchboard.core.config.model.GenesysConfig;
import io.switchboard.core.config.model.ProvidersConfig;
import io.switchboard.core.config.model.SwitchboardConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Reads {@code config.json}, fills anything missing from
 * {@link SwitchboardConfig#defaults()} and lets environment variables supply
 * secrets.
 */
public final class ConfigService {
    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public SwitchboardConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        SwitchboardConfig config;
        if (!Files.exists(configPath)) {
            config = SwitchboardConfig.defaults();
        } else {
            JsonNode defaultsNode = mapper.valueToTree(SwitchboardConfig.defaults());
            JsonNode existingNode = mapper.readTree(Files.readString(configPath));
            JsonNode merged = deepMerge(defaultsNode, existingNode);
            config = mapper.treeToValue(merged, SwitchboardConfig.class);
        }
        return applyEnvironment(config);
    }

    public void save(Path configPath, SwitchboardConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public String toPrettyJson(SwitchboardConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private SwitchboardConfig applyEnvironment(SwitchboardConfig config) {
        ProvidersConfig providers = new ProvidersConfig(
            config.providers().openai().withApiKey(env("OPENAI_API_KEY", config.providers().openai().apiKey())),
            config.providers().openrouter().withApiKey(env("OPENROUTER_API_KEY", config.providers().openrouter().apiKey()))
        );
        GenesysConfig genesys = config.genesys().withCredentials(
            env("GENESYS_CLOUD_CLIENT_ID", config.genesys().clientId()),
            env("GENESYS_CLOUD_CLIENT_SECRET", config.genesys().clientSecret()),
            env("GENESYS_OPEN_MESSAGING_DEPLOYMENT_ID", config.genesys().deploymentId())
        );
        return config
            .withProviders(providers)
            .withGenesys(genesys)
            .withServer(config.server().withWebhookToken(env("SWITCHBOARD_WEBHOOK_TOKEN", config.server().webhookToken())));
    }

    private String env(String name, String fallback) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? fallback : value;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
