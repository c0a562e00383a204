package io.switchboard.core.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.ChatMessage;
import io.switchboard.core.provider.ChatOptions;
import io.switchboard.core.provider.LlmProvider;
import io.switchboard.core.provider.LlmResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmDecisionOracle implements DecisionOracle {
    private static final Logger LOG = LoggerFactory.getLogger(LlmDecisionOracle.class);

    private final LlmProvider provider;
    private final String model;
    private final double temperature;
    private final OraclePrompts prompts;
    private final ObjectMapper mapper = new ObjectMapper();

    public LlmDecisionOracle(LlmProvider provider, String model, double temperature, OraclePrompts prompts) {
        this.provider = provider;
        this.model = model;
        this.temperature = temperature;
        this.prompts = prompts;
    }

    @Override
    public RoutingDecision decideRouting(
        String userText,
        List<ChatMessage> recentHistory,
        List<String> memories,
        boolean externalSessionActive
    ) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(prompts.routing(externalSessionActive)));
        if (memories != null && !memories.isEmpty()) {
            messages.add(ChatMessage.system("Remembered information about this conversation:\n- " + String.join("\n- ", memories)));
        }
        messages.addAll(recentHistory);
        messages.add(ChatMessage.user("User message to route: " + userText));

        JsonNode root = complete(messages, "routing");
        if (root == null) {
            return RoutingDecision.fallback("oracle unavailable");
        }
        JsonNode respond = field(root, "should_respond_to_user", "respondToUser");
        JsonNode forward = field(root, "should_send_to_external", "should_send_to_genesys", "forwardToExternal");
        if (!respond.isBoolean() || !forward.isBoolean()) {
            LOG.warn("Routing decision is missing required flags: {}", root);
            return RoutingDecision.fallback("malformed oracle output");
        }
        RoutingDecision decision = new RoutingDecision(
            respond.booleanValue(),
            forward.booleanValue(),
            text(field(root, "user_response", "userText")),
            text(field(root, "external_message", "genesys_message", "externalText")),
            text(field(root, "explanation"))
        );
        LOG.info(
            "Routing decision respondToUser={} forwardToExternal={} ({})",
            decision.respondToUser(),
            decision.forwardToExternal(),
            decision.explanation()
        );
        return decision;
    }

    @Override
    public ExternalResponseDecision decideExternalResponse(
        String agentText,
        List<ChatMessage> recentHistory,
        String ownerContext
    ) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(prompts.externalResponse()));
        messages.addAll(recentHistory);
        String context = ownerContext == null || ownerContext.isBlank() ? "None available" : ownerContext;
        messages.add(ChatMessage.user("Live agent message: " + agentText + "\nUser context: " + context));

        JsonNode root = complete(messages, "external response");
        if (root == null) {
            return ExternalResponseDecision.fallback(agentText, "oracle unavailable");
        }
        JsonNode reply = field(root, "should_respond_to_external", "should_respond_to_genesys", "replyToExternal");
        JsonNode ask = field(root, "should_ask_user", "askUser");
        if (!reply.isBoolean() || !ask.isBoolean()) {
            LOG.warn("External response decision is missing required flags: {}", root);
            return ExternalResponseDecision.fallback(agentText, "malformed oracle output");
        }
        ExternalResponseDecision decision = new ExternalResponseDecision(
            reply.booleanValue(),
            ask.booleanValue(),
            text(field(root, "external_response", "genesys_response", "externalText")),
            text(field(root, "user_question", "userQuestion")),
            text(field(root, "explanation"))
        );
        LOG.info(
            "External response decision replyToExternal={} askUser={} ({})",
            decision.replyToExternal(),
            decision.askUser(),
            decision.explanation()
        );
        return decision;
    }

    private JsonNode complete(List<ChatMessage> messages, String purpose) {
        LlmResponse response;
        try {
            response = provider.chat(model, messages, List.of(), ChatOptions.json(temperature));
        } catch (RuntimeException e) {
            LOG.error("Oracle call for {} failed", purpose, e);
            return null;
        }
        if (response.isError()) {
            LOG.error("Oracle call for {} failed: {}", purpose, response.content());
            return null;
        }
        try {
            JsonNode root = mapper.readTree(stripFences(response.content()));
            if (root == null || !root.isObject()) {
                LOG.warn("Oracle answered {} with a non-object: {}", purpose, response.content());
                return null;
            }
            return root;
        } catch (JsonProcessingException e) {
            LOG.warn("Oracle answered {} with invalid JSON: {}", purpose, e.getOriginalMessage());
            return null;
        }
    }

    private JsonNode field(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode value = root.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return root.path(names[0]);
    }

    private String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText("").trim();
        return value.isEmpty() ? null : value;
    }

    static String stripFences(String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }
}
