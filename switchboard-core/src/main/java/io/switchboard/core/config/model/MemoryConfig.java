package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param mode {@code llm}, {@code heuristic} or {@code off}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(String mode) {

    public static MemoryConfig defaults() {
        return new MemoryConfig("llm");
    }
}
