package io.switchboard.core.oracle;

/**
 * What to do with one customer message. Either text may be absent even when
 * its flag is set; callers check both.
 */
public record RoutingDecision(
    boolean respondToUser,
    boolean forwardToExternal,
    String userText,
    String externalText,
    String explanation
) {
    public static final String FALLBACK_USER_TEXT = "I understand you're looking for help. Let me assist you with that.";

    public static RoutingDecision fallback(String reason) {
        return new RoutingDecision(true, false, FALLBACK_USER_TEXT, null, "Fallback decision: " + reason);
    }

    public boolean hasUserText() {
        return userText != null && !userText.isBlank();
    }

    public boolean hasExternalText() {
        return externalText != null && !externalText.isBlank();
    }

    public RoutingDecision withRespondToUser() {
        return new RoutingDecision(true, forwardToExternal, userText, externalText, explanation);
    }
}
