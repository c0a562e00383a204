package io.switchboard.core.provider;

/**
 * Per-call sampling options. A null field leaves the provider default in place.
 */
public record ChatOptions(Double temperature, Integer maxTokens, boolean jsonMode) {

    public static ChatOptions defaults() {
        return new ChatOptions(null, null, false);
    }

    public static ChatOptions json(double temperature) {
        return new ChatOptions(temperature, null, true);
    }

    public ChatOptions withMaxTokens(int maxTokens) {
        return new ChatOptions(temperature, maxTokens, jsonMode);
    }
}
