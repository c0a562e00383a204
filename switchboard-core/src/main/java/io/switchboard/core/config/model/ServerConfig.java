package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(
    String host,
    int port,
    @JsonAlias({"webhook_token"}) String webhookToken,
    @JsonAlias({"cors_origins"}) List<String> corsOrigins
) {

    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", 8080, "", List.of("http://localhost:3000"));
    }

    public ServerConfig withWebhookToken(String token) {
        return new ServerConfig(host, port, token, corsOrigins);
    }
}
