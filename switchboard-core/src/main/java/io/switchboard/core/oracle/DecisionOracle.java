package io.switchboard.core.oracle;

import io.switchboard.core.model.ChatMessage;
import java.util.List;

/**
 * Structured routing decisions from a language model. Implementations never
 * throw; any failure yields the fallback decision.
 */
public interface DecisionOracle {
    RoutingDecision decideRouting(
        String userText,
        List<ChatMessage> recentHistory,
        List<String> memories,
        boolean externalSessionActive
    );

    ExternalResponseDecision decideExternalResponse(
        String agentText,
        List<ChatMessage> recentHistory,
        String ownerContext
    );
}
