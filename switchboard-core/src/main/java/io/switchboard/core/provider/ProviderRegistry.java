package io.switchboard.core.provider;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ProviderRegistry {
    private final Map<String, LlmProvider> providers = new ConcurrentHashMap<>();

    public void register(LlmProvider provider) {
        providers.put(normalize(provider.name()), provider);
    }

    public Optional<LlmProvider> find(String name) {
        return Optional.ofNullable(providers.get(normalize(name)));
    }

    /**
     * Builds a fallback chain over the named providers, skipping names that
     * were never registered.
     */
    public LlmProvider chain(String name, List<String> order) {
        List<LlmProvider> members = order.stream()
            .map(this::find)
            .flatMap(Optional::stream)
            .toList();
        if (members.isEmpty()) {
            return new DisabledProvider(name, "no registered providers in " + order);
        }
        return new FallbackLlmProvider(name, members);
    }

    private String normalize(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
