package io.switchboard.core.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.correlation.ExternalSession;
import io.switchboard.core.error.ExternalDeliveryException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends agentless Open Messaging messages through the Genesys Cloud platform
 * API. Authenticates with the OAuth client-credentials grant and reuses the
 * token until shortly before it expires.
 */
public final class GenesysOpenMessagingForwarder implements ExternalForwarder {
    private static final Logger LOG = LoggerFactory.getLogger(GenesysOpenMessagingForwarder.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final HttpUrl apiBase;
    private final HttpUrl loginBase;
    private final String clientId;
    private final String clientSecret;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Clock clock;

    private String accessToken;
    private Instant accessTokenExpiresAt = Instant.EPOCH;

    public GenesysOpenMessagingForwarder(
        String apiBase,
        String loginBase,
        String clientId,
        String clientSecret,
        Duration timeout,
        Clock clock
    ) {
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.loginBase = HttpUrl.get(Objects.requireNonNull(loginBase, "loginBase must not be null"));
        this.clientId = Objects.requireNonNull(clientId, "clientId must not be null");
        this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret must not be null");
        this.client = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .build();
        this.mapper = new ObjectMapper();
        this.clock = clock;
    }

    @Override
    public String name() {
        return "genesys";
    }

    @Override
    public ExternalSendResult send(String fromAddress, String toAddress, String text, ExternalSession session) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("fromAddress", fromAddress);
        payload.put("toAddress", toAddress);
        payload.put("toAddressMessengerType", "open");
        payload.put("textBody", text);
        payload.put("useExistingActiveConversation", true);

        try {
            Request request = new Request.Builder()
                .url(apiBase.newBuilder().addPathSegments("api/v2/conversations/messages/agentless").build())
                .header("Authorization", "Bearer " + token())
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();
            try (Response response = client.newCall(request).execute()) {
                String body = bodyOf(response);
                if (response.code() == 401) {
                    invalidateToken();
                }
                if (!response.isSuccessful()) {
                    throw new ExternalDeliveryException("Agentless send failed with HTTP " + response.code() + ": " + body);
                }
                String messageId = body.isBlank() ? null : textOrNull(mapper.readTree(body).path("id"));
                LOG.info(
                    "Forwarded message to {} (session {}, external id {})",
                    toAddress,
                    session == null ? "-" : session.sessionId(),
                    messageId
                );
                return new ExternalSendResult(messageId);
            }
        } catch (IOException e) {
            throw new ExternalDeliveryException("Agentless send to " + toAddress + " failed: " + e.getMessage(), e);
        }
    }

    private synchronized String token() throws IOException {
        Instant now = clock.instant();
        if (accessToken != null && now.isBefore(accessTokenExpiresAt.minus(TOKEN_EXPIRY_MARGIN))) {
            return accessToken;
        }
        Request request = new Request.Builder()
            .url(loginBase.newBuilder().addPathSegments("oauth/token").build())
            .header("Authorization", Credentials.basic(clientId, clientSecret))
            .post(new FormBody.Builder().add("grant_type", "client_credentials").build())
            .build();
        try (Response response = client.newCall(request).execute()) {
            String body = bodyOf(response);
            if (!response.isSuccessful()) {
                throw new ExternalDeliveryException("OAuth token request failed with HTTP " + response.code() + ": " + body);
            }
            JsonNode root = mapper.readTree(body);
            String token = textOrNull(root.path("access_token"));
            if (token == null) {
                throw new ExternalDeliveryException("OAuth token response carried no access_token");
            }
            accessToken = token;
            accessTokenExpiresAt = now.plusSeconds(root.path("expires_in").asLong(3600));
            LOG.debug("Obtained Genesys access token valid until {}", accessTokenExpiresAt);
            return accessToken;
        }
    }

    private synchronized void invalidateToken() {
        accessToken = null;
        accessTokenExpiresAt = Instant.EPOCH;
    }

    private String bodyOf(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText("");
        return value.isBlank() ? null : value;
    }
}
