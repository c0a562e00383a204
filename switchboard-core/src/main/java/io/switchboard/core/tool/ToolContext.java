package io.switchboard.core.tool;

import java.util.Map;

/**
 * The conversation a tool call runs for, plus the services it may use.
 */
public record ToolContext(String conversationId, String ownerAddress, Map<String, Object> services) {

    public ToolContext {
        services = services == null ? Map.of() : Map.copyOf(services);
    }

    public <T> T service(String key, Class<T> type) {
        Object service = services.get(key);
        if (service == null) {
            return null;
        }
        if (!type.isInstance(service)) {
            throw new IllegalArgumentException("Service '" + key + "' is not of type " + type.getSimpleName());
        }
        return type.cast(service);
    }
}
