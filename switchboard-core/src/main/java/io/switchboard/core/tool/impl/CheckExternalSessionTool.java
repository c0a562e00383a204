package io.switchboard.core.tool.impl;

import io.switchboard.core.correlation.CorrelationRegistry;
import io.switchboard.core.tool.Tool;
import io.switchboard.core.tool.ToolContext;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CheckExternalSessionTool implements Tool {
    private static final Logger LOG = LoggerFactory.getLogger(CheckExternalSessionTool.class);

    static final String CONNECTED = "This chat is connected to a live agent support session. "
        + "Your messages will be forwarded to the agent.";
    static final String NOT_CONNECTED = "This chat is not currently connected to a live agent. "
        + "Would you like me to connect you with a live agent?";
    static final String FAILED = "I couldn't check the live agent connection right now. Please try again in a moment.";

    @Override
    public String name() {
        return "check_external_session";
    }

    @Override
    public String description() {
        return "Check whether this chat is connected to a live agent support session.";
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        CorrelationRegistry registry = context.service("correlationRegistry", CorrelationRegistry.class);
        if (registry == null) {
            return NOT_CONNECTED;
        }
        try {
            return registry.activeSession(context.conversationId()).isPresent() ? CONNECTED : NOT_CONNECTED;
        } catch (IOException e) {
            LOG.warn("Session check failed for conversation {}", context.conversationId(), e);
            return FAILED;
        }
    }
}
