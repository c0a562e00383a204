package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Genesys Cloud Open Messaging credentials. {@code region} is the Genesys
 * domain suffix, e.g. {@code mypurecloud.com} or {@code mypurecloud.ie}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenesysConfig(
    String region,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"login_base"}) String loginBase,
    @JsonAlias({"client_id"}) String clientId,
    @JsonAlias({"client_secret"}) String clientSecret,
    @JsonAlias({"deployment_id"}) String deploymentId,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static GenesysConfig defaults() {
        return new GenesysConfig("mypurecloud.com", null, null, "", "", "", 20);
    }

    public boolean configured() {
        return notBlank(clientId) && notBlank(clientSecret) && notBlank(deploymentId);
    }

    public String resolvedApiBase() {
        return notBlank(apiBase) ? apiBase : "https://api." + region;
    }

    public String resolvedLoginBase() {
        return notBlank(loginBase) ? loginBase : "https://login." + region;
    }

    public GenesysConfig withCredentials(String id, String secret, String deployment) {
        return new GenesysConfig(region, apiBase, loginBase, id, secret, deployment, timeoutSeconds);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
