package io.switchboard.core.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.error.InvalidPayloadException;
import io.switchboard.core.model.QuickReply;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes Genesys Open Messaging webhook bodies. This is the only place the
 * vendor's wire format is read.
 */
public final class VendorEventParser {
    private final ObjectMapper mapper;

    public VendorEventParser() {
        this(new ObjectMapper());
    }

    public VendorEventParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public VendorEvent parse(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw new InvalidPayloadException("empty webhook payload");
        }
        JsonNode root;
        try {
            root = mapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("webhook payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidPayloadException("webhook payload must be a JSON object");
        }

        JsonNode channel = root.path("channel");
        List<QuickReply> quickReplies = quickReplies(root.path("content"));
        VendorEventKind kind = kind(root, quickReplies);
        String recipient = firstText(channel.path("to").path("id"), root.path("to").path("id"));
        if (kind.carriesText() && recipient == null) {
            throw new InvalidPayloadException("webhook payload has no recipient address");
        }

        return new VendorEvent(
            kind,
            firstText(root.path("id"), channel.path("messageId")),
            recipient,
            firstText(
                channel.path("from").path("nickname"),
                root.path("from").path("nickname"),
                channel.path("from").path("id")
            ),
            firstText(root.path("text")),
            quickReplies,
            firstText(root.path("direction"))
        );
    }

    private VendorEventKind kind(JsonNode root, List<QuickReply> quickReplies) {
        String type = firstText(root.path("type"));
        switch (type == null ? "" : type.toLowerCase(Locale.ROOT)) {
            case "text":
                return quickReplies.isEmpty() ? VendorEventKind.TEXT : VendorEventKind.STRUCTURED;
            case "structured":
                return VendorEventKind.STRUCTURED;
            case "receipt":
                return VendorEventKind.RECEIPT;
            case "event":
                for (JsonNode event : root.path("events")) {
                    if ("typing".equalsIgnoreCase(event.path("eventType").asText(""))) {
                        return VendorEventKind.TYPING;
                    }
                }
                return VendorEventKind.UNKNOWN;
            case "typing":
                return VendorEventKind.TYPING;
            case "":
                return root.hasNonNull("text") ? VendorEventKind.TEXT : VendorEventKind.UNKNOWN;
            default:
                return VendorEventKind.UNKNOWN;
        }
    }

    private List<QuickReply> quickReplies(JsonNode content) {
        if (content == null || !content.isArray()) {
            return List.of();
        }
        List<QuickReply> replies = new ArrayList<>();
        for (JsonNode item : content) {
            JsonNode quickReply = item.path("quickReply");
            if (quickReply.isMissingNode() && "quickreply".equalsIgnoreCase(item.path("contentType").asText(""))) {
                quickReply = item;
            }
            String text = firstText(quickReply.path("text"));
            if (text != null) {
                replies.add(new QuickReply(text, firstText(quickReply.path("payload"))));
            }
        }
        return replies;
    }

    private String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate != null && candidate.isValueNode() && !candidate.isNull()) {
                String value = candidate.asText("").trim();
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return null;
    }
}
