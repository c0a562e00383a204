package io.switchboard.core.tool;

import java.util.Map;

public interface Tool {
    String name();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    /**
     * Runs the tool and returns the sentence shown to the customer.
     */
    String execute(Map<String, Object> input, ToolContext context);
}
