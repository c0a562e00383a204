package io.switchboard.core.oracle;

/**
 * What to do with one live-agent message: answer the agent, ask the
 * customer, both, or neither.
 */
public record ExternalResponseDecision(
    boolean replyToExternal,
    boolean askUser,
    String externalText,
    String userQuestion,
    String explanation
) {

    public static ExternalResponseDecision fallback(String agentText, String reason) {
        return new ExternalResponseDecision(
            false,
            true,
            null,
            "The agent says: " + agentText + "\n\nHow would you like me to respond?",
            "Fallback decision: " + reason
        );
    }

    public boolean hasExternalText() {
        return externalText != null && !externalText.isBlank();
    }

    public boolean hasUserQuestion() {
        return userQuestion != null && !userQuestion.isBlank();
    }
}
