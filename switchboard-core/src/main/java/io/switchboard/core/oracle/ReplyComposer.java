package io.switchboard.core.oracle;

import io.switchboard.core.model.ChatMessage;
import io.switchboard.core.model.ToolCall;
import io.switchboard.core.provider.ChatOptions;
import io.switchboard.core.provider.LlmProvider;
import io.switchboard.core.provider.LlmResponse;
import io.switchboard.core.tool.Tool;
import io.switchboard.core.tool.ToolContext;
import io.switchboard.core.tool.ToolRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the customer-facing reply when the routing decision asked for one
 * without supplying the text. The model may call one tool; its result is the
 * reply.
 */
public final class ReplyComposer {
    private static final Logger LOG = LoggerFactory.getLogger(ReplyComposer.class);

    private final LlmProvider provider;
    private final String model;
    private final OraclePrompts prompts;
    private final ToolRegistry tools;

    public ReplyComposer(LlmProvider provider, String model, OraclePrompts prompts, ToolRegistry tools) {
        this.provider = provider;
        this.model = model;
        this.prompts = prompts;
        this.tools = tools;
    }

    public String compose(String userText, List<ChatMessage> history, List<String> memories, ToolContext context) {
        List<ChatMessage> messages = new ArrayList<>();
        StringBuilder system = new StringBuilder(prompts.reply());
        if (memories != null && !memories.isEmpty()) {
            system.append("\n\nRemembered information about this conversation:\n- ").append(String.join("\n- ", memories));
        }
        messages.add(ChatMessage.system(system.toString()));
        messages.addAll(history);
        messages.add(ChatMessage.user(userText));

        LlmResponse response;
        try {
            response = provider.chat(model, messages, tools.definitions(), ChatOptions.defaults());
        } catch (RuntimeException e) {
            LOG.error("Reply composition failed for conversation {}", context.conversationId(), e);
            return RoutingDecision.FALLBACK_USER_TEXT;
        }
        if (response.isError()) {
            LOG.error("Reply composition failed for conversation {}: {}", context.conversationId(), response.content());
            return RoutingDecision.FALLBACK_USER_TEXT;
        }

        if (response.hasToolCalls()) {
            ToolCall call = response.toolCalls().get(0);
            Optional<Tool> tool = tools.find(call.name());
            if (tool.isEmpty()) {
                LOG.warn("Model requested unknown tool {}", call.name());
                return RoutingDecision.FALLBACK_USER_TEXT;
            }
            LOG.info("Reply for conversation {} produced by tool {}", context.conversationId(), call.name());
            return tool.get().execute(call.arguments(), context);
        }

        String content = response.content().trim();
        return content.isEmpty() ? RoutingDecision.FALLBACK_USER_TEXT : content;
    }
}
