package io.switchboard.core.oracle;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchboard.core.correlation.CorrelationRegistry;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.Owner;
import io.switchboard.core.model.ToolCall;
import io.switchboard.core.provider.LlmResponse;
import io.switchboard.core.routing.RelayStores;
import io.switchboard.core.testing.ScriptedProvider;
import io.switchboard.core.testing.TestStores;
import io.switchboard.core.tool.ToolContext;
import io.switchboard.core.tool.ToolRegistry;
import io.switchboard.core.tool.impl.CheckExternalSessionTool;
import io.switchboard.core.tool.impl.ConnectLiveAgentTool;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReplyComposerTest {

    @TempDir
    Path tempDir;

    private RelayStores stores;
    private ToolRegistry tools;
    private ToolContext context;

    @BeforeEach
    void setUp() throws Exception {
        stores = TestStores.sqlite(tempDir);
        Owner owner = stores.owners().register("user@ex.com");
        Conversation conversation = stores.conversations().create(owner.id(), null);
        tools = new ToolRegistry();
        tools.register(new CheckExternalSessionTool());
        tools.register(new ConnectLiveAgentTool());
        context = new ToolContext(
            conversation.id(),
            owner.email(),
            Map.of("correlationRegistry", new CorrelationRegistry(stores.conversations()))
        );
    }

    @Test
    void shouldReturnModelTextAndOfferTools() {
        ScriptedProvider provider = new ScriptedProvider().reply("Have you tried restarting the blender?");
        ReplyComposer composer = new ReplyComposer(provider, "gpt-test", OraclePrompts.defaults(), tools);

        String reply = composer.compose("My blender won't start", List.of(), List.of("Product model number is BX-200"), context);

        assertThat(reply).isEqualTo("Have you tried restarting the blender?");
        assertThat(provider.lastTools()).hasSize(2);
        assertThat(provider.lastRequest().get(0).content()).contains("Product model number is BX-200");
    }

    @Test
    void shouldAnswerWithToolResultWhenModelCallsTool() throws Exception {
        ScriptedProvider provider = new ScriptedProvider().reply(new LlmResponse(
            "",
            List.of(new ToolCall("call-1", "connect_live_agent", Map.of("reason", "refund"))),
            Map.of()
        ));
        ReplyComposer composer = new ReplyComposer(provider, "gpt-test", OraclePrompts.defaults(), tools);

        String reply = composer.compose("Let me talk to a person", List.of(), List.of(), context);

        assertThat(reply).startsWith("You've been connected with a live agent");
        assertThat(stores.conversations().find(context.conversationId()).orElseThrow().hasActiveExternalSession()).isTrue();
    }

    @Test
    void shouldFallBackOnErrorsAndUnknownTools() {
        ScriptedProvider provider = new ScriptedProvider()
            .reply(LlmResponse.error("timeout"))
            .reply(new LlmResponse("", List.of(new ToolCall("call-2", "delete_everything", Map.of())), Map.of()))
            .reply("   ");
        ReplyComposer composer = new ReplyComposer(provider, "gpt-test", OraclePrompts.defaults(), tools);

        for (int i = 0; i < 3; i++) {
            assertThat(composer.compose("hi", List.of(), List.of(), context)).isEqualTo(RoutingDecision.FALLBACK_USER_TEXT);
        }
    }
}
