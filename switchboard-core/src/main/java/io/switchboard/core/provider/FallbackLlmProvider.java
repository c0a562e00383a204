package io.switchboard.core.provider;

import io.switchboard.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> members() {
        return chain.stream().map(LlmProvider::name).toList();
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools, ChatOptions options) {
        LlmResponse last = LlmResponse.error("no providers in fallback chain " + name);
        for (LlmProvider provider : chain) {
            last = provider.chat(model, messages, tools, options);
            if (!last.isError()) {
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return last;
            }
            LOG.warn("Provider {} failed in chain {}: {}", provider.name(), name, abbreviate(last.content(), 300));
        }
        return last;
    }

    private String abbreviate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
