package io.switchboard.core.tool.impl;

import io.switchboard.core.correlation.CorrelationRegistry;
import io.switchboard.core.correlation.ExternalSession;
import io.switchboard.core.error.RelayException;
import io.switchboard.core.tool.Tool;
import io.switchboard.core.tool.ToolContext;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the live-agent session for the chat. Safe to call repeatedly; an
 * existing session is reused.
 */
public final class ConnectLiveAgentTool implements Tool {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectLiveAgentTool.class);

    static final String CONNECTED = "You've been connected with a live agent support session. "
        + "Your messages will be forwarded to the agent who will respond shortly.";
    static final String FAILED = "I wasn't able to connect you with a live agent at this time. "
        + "Please try again later or let me help you with your question.";

    @Override
    public String name() {
        return "connect_live_agent";
    }

    @Override
    public String description() {
        return "Connect this chat to a live agent support session.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "reason", Map.of("type", "string", "description", "Short reason the customer needs a live agent")
            )
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        CorrelationRegistry registry = context.service("correlationRegistry", CorrelationRegistry.class);
        if (registry == null) {
            return FAILED;
        }
        try {
            ExternalSession session = registry.ensureSession(context.conversationId());
            if (!session.active()) {
                LOG.info("Live agent integration is switched off for conversation {}", context.conversationId());
                return FAILED;
            }
            return CONNECTED;
        } catch (IOException | RelayException e) {
            LOG.warn("Could not open a live agent session for conversation {}", context.conversationId(), e);
            return FAILED;
        }
    }
}
