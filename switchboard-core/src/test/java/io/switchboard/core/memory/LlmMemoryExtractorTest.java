package io.switchboard.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchboard.core.model.ChatMessage;
import io.switchboard.core.oracle.OraclePrompts;
import io.switchboard.core.provider.LlmResponse;
import io.switchboard.core.testing.ScriptedProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

class LlmMemoryExtractorTest {

    @Test
    void shouldReturnStatementFromModel() {
        ScriptedProvider provider = new ScriptedProvider().reply("\"User's order number is 5521\"");
        LlmMemoryExtractor extractor = new LlmMemoryExtractor(provider, "gpt-test", OraclePrompts.defaults());

        assertThat(extractor.extract("My order is 5521", List.of(ChatMessage.assistant("How can I help?"))))
            .contains("User's order number is 5521");
        assertThat(provider.lastOptions().maxTokens()).isEqualTo(200);
        assertThat(provider.lastOptions().temperature()).isEqualTo(0.3);
        assertThat(provider.lastRequest().get(0).content()).contains("My order is 5521");
    }

    @Test
    void shouldTreatSentinelAndErrorsAsNothingToRemember() {
        ScriptedProvider provider = new ScriptedProvider()
            .reply(LlmMemoryExtractor.NO_MEMORY)
            .reply(LlmResponse.error("HTTP 500"));
        LlmMemoryExtractor extractor = new LlmMemoryExtractor(provider, "gpt-test", OraclePrompts.defaults());

        assertThat(extractor.extract("ok thanks", List.of())).isEmpty();
        assertThat(extractor.extract("ok thanks", List.of())).isEmpty();
    }
}
