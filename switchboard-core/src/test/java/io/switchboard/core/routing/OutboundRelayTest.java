package io.switchboard.core.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.switchboard.core.correlation.CorrelationRegistry;
import io.switchboard.core.error.AddressFormatException;
import io.switchboard.core.error.ConversationNotFoundException;
import io.switchboard.core.error.InvalidPayloadException;
import io.switchboard.core.error.NoActiveSessionException;
import io.switchboard.core.error.OwnershipMismatchException;
import io.switchboard.core.external.VendorEventParser;
import io.switchboard.core.fanout.ConversationRooms;
import io.switchboard.core.fanout.MessageEvent;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.MessageOrigin;
import io.switchboard.core.model.Owner;
import io.switchboard.core.model.TranscriptMessage;
import io.switchboard.core.oracle.ExternalResponseDecision;
import io.switchboard.core.testing.RecordingForwarder;
import io.switchboard.core.testing.RecordingSubscriber;
import io.switchboard.core.testing.StubOracle;
import io.switchboard.core.testing.TestStores;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutboundRelayTest {

    @TempDir
    Path tempDir;

    private RelayStores stores;
    private Conversation conversation;
    private StubOracle oracle;
    private RecordingForwarder forwarder;
    private RecordingSubscriber subscriber;
    private OutboundRelay relay;

    @BeforeEach
    void setUp() throws Exception {
        stores = TestStores.sqlite(tempDir);
        Owner owner = stores.owners().register("user@ex.com");
        conversation = stores.conversations().create(owner.id(), null);
        stores.conversations().assignExternalSession(conversation.id(), "session-1");
        oracle = new StubOracle();
        forwarder = new RecordingForwarder();
        ConversationRooms fanout = new ConversationRooms();
        subscriber = new RecordingSubscriber("browser");
        fanout.join(conversation.id(), subscriber);
        relay = new OutboundRelay(
            stores,
            new VendorEventParser(),
            oracle,
            new CorrelationRegistry(stores.conversations()),
            forwarder,
            fanout,
            new RelaySettings(5, "deployment-1")
        );
    }

    @Test
    void shouldRecordAgentMessageAndAnswerFromMemory() throws Exception {
        stores.memories().remember(conversation.id(), "Product model number is BX-200");
        oracle.respondWith(new ExternalResponseDecision(true, false, "The model number is BX-200.", null, "known"));

        RelayOutcome outcome = relay.handleExternalEvent(agentText("evt-1", "user+" + conversation.id() + "@ex.com", "Which model do you have?"));

        assertThat(outcome).isEqualTo(new RelayOutcome(RelayStatus.PROCESSED, conversation.id()));
        List<TranscriptMessage> transcript = stores.transcripts().listByConversation(conversation.id());
        assertThat(transcript).extracting(TranscriptMessage::origin)
            .containsExactly(MessageOrigin.EXTERNAL_SYSTEM, MessageOrigin.LOCAL_SYSTEM);
        assertThat(transcript.get(1).sentExternally()).isTrue();
        assertThat(forwarder.sent()).extracting(RecordingForwarder.Sent::text).containsExactly("The model number is BX-200.");
        assertThat(forwarder.sent().get(0).toAddress()).isEqualTo("user+" + conversation.id() + "@ex.com");
        assertThat(oracle.ownerContexts).containsExactly("- Product model number is BX-200");
        assertThat(subscriber.events()).extracting(e -> e.message().origin())
            .containsExactly(MessageOrigin.EXTERNAL_SYSTEM, MessageOrigin.LOCAL_SYSTEM);
    }

    @Test
    void shouldAskCustomerAndAnswerAgentInSameEvent() throws Exception {
        oracle.respondWith(new ExternalResponseDecision(
            true, true, "Let me check with the customer.", "The agent asks for your order number. What is it?", "both"
        ));

        relay.handleExternalEvent(agentText("evt-2", "user+" + conversation.id() + "@ex.com", "Order number?"));

        List<TranscriptMessage> transcript = stores.transcripts().listByConversation(conversation.id());
        assertThat(transcript).hasSize(3);
        assertThat(transcript.get(2).content()).isEqualTo("The agent asks for your order number. What is it?");
        assertThat(transcript.get(2).sentExternally()).isFalse();
        assertThat(forwarder.sent()).hasSize(1);
    }

    @Test
    void shouldRelayAgentQuestionWhenOracleFails() throws Exception {
        oracle.failWith(new IllegalStateException("oracle down"));

        relay.handleExternalEvent(agentText("evt-3", "user+" + conversation.id() + "@ex.com", "Is it plugged in?"));

        List<TranscriptMessage> transcript = stores.transcripts().listByConversation(conversation.id());
        assertThat(transcript.get(1).content())
            .isEqualTo("The agent says: Is it plugged in?\n\nHow would you like me to respond?");
        assertThat(forwarder.sent()).isEmpty();
    }

    @Test
    void shouldStoreDuplicateEventOnce() throws Exception {
        String payload = agentText("evt-4", "user+" + conversation.id() + "@ex.com", "Hello there");

        RelayOutcome first = relay.handleExternalEvent(payload);
        RelayOutcome second = relay.handleExternalEvent(payload);

        assertThat(first.status()).isEqualTo(RelayStatus.PROCESSED);
        assertThat(second.status()).isEqualTo(RelayStatus.DUPLICATE);
        assertThat(stores.transcripts().listByConversation(conversation.id()))
            .filteredOn(m -> m.origin() == MessageOrigin.EXTERNAL_SYSTEM)
            .hasSize(1);
        assertThat(oracle.ownerContexts).hasSize(1);
    }

    @Test
    void shouldRejectAddressOfAnotherOwnerWithoutWriting() throws Exception {
        assertThatThrownBy(() -> relay.handleExternalEvent(agentText("evt-5", "mallory+" + conversation.id() + "@evil.com", "hi")))
            .isInstanceOf(OwnershipMismatchException.class);

        assertThat(stores.transcripts().listByConversation(conversation.id())).isEmpty();
        assertThat(subscriber.events()).isEmpty();
    }

    @Test
    void shouldMatchOwnerAddressIgnoringCase() throws Exception {
        RelayOutcome outcome = relay.handleExternalEvent(agentText("evt-6", "User+" + conversation.id() + "@EX.com", "hi"));

        assertThat(outcome.status()).isEqualTo(RelayStatus.PROCESSED);
    }

    @Test
    void shouldRejectUnknownConversationAndMalformedInput() {
        assertThatThrownBy(() -> relay.handleExternalEvent(agentText("evt-7", "user+nope@ex.com", "hi")))
            .isInstanceOf(ConversationNotFoundException.class);
        assertThatThrownBy(() -> relay.handleExternalEvent(agentText("evt-8", "user@ex.com", "hi")))
            .isInstanceOf(AddressFormatException.class);
        assertThatThrownBy(() -> relay.handleExternalEvent("{oops"))
            .isInstanceOf(InvalidPayloadException.class);
    }

    @Test
    void shouldRequireActiveSession() throws Exception {
        Owner owner = stores.owners().findByEmail("user@ex.com").orElseThrow();
        Conversation fresh = stores.conversations().create(owner.id(), null);

        assertThatThrownBy(() -> relay.handleExternalEvent(agentText("evt-9", "user+" + fresh.id() + "@ex.com", "hi")))
            .isInstanceOf(NoActiveSessionException.class);
        assertThat(stores.transcripts().listByConversation(fresh.id())).isEmpty();
    }

    @Test
    void shouldIgnoreEventsForClosedConversation() throws Exception {
        stores.conversations().close(conversation.id());

        RelayOutcome outcome = relay.handleExternalEvent(agentText("evt-10", "user+" + conversation.id() + "@ex.com", "still there?"));

        assertThat(outcome.status()).isEqualTo(RelayStatus.IGNORED);
        assertThat(stores.transcripts().listByConversation(conversation.id())).isEmpty();
    }

    @Test
    void shouldSendNothingWhenConversationClosesWhileDeciding() throws Exception {
        oracle.respondWith(new ExternalResponseDecision(true, true, "It is BX-200.", "Which model do you have?", "both"))
            .whileDeciding(() -> stores.conversations().close(conversation.id()));

        RelayOutcome outcome = relay.handleExternalEvent(agentText("evt-12", "user+" + conversation.id() + "@ex.com", "Model?"));

        assertThat(outcome.status()).isEqualTo(RelayStatus.PROCESSED);
        assertThat(forwarder.sent()).isEmpty();
        assertThat(stores.transcripts().listByConversation(conversation.id()))
            .extracting(TranscriptMessage::origin)
            .containsExactly(MessageOrigin.EXTERNAL_SYSTEM);
        assertThat(subscriber.events()).hasSize(1);
    }

    @Test
    void shouldNotAnswerAgentOnceForwardingIsSwitchedOff() throws Exception {
        CorrelationRegistry registry = new CorrelationRegistry(stores.conversations());
        oracle.respondWith(new ExternalResponseDecision(true, false, "It is BX-200.", null, "known"))
            .whileDeciding(() -> registry.setForwarding(conversation.id(), false));

        relay.handleExternalEvent(agentText("evt-13", "user+" + conversation.id() + "@ex.com", "Model?"));

        assertThat(forwarder.sent()).isEmpty();
        assertThat(stores.transcripts().listByConversation(conversation.id())).hasSize(1);
        assertThatThrownBy(() -> relay.handleExternalEvent(agentText("evt-14", "user+" + conversation.id() + "@ex.com", "Hello?")))
            .isInstanceOf(NoActiveSessionException.class);
    }

    @Test
    void shouldIgnoreReceiptsWithoutTouchingState() throws Exception {
        RelayOutcome outcome = relay.handleExternalEvent("""
            {"id": "r-1", "type": "Receipt", "status": "Delivered", "channel": {"to": {"id": "user+%s@ex.com"}}}
            """.formatted(conversation.id()));

        assertThat(outcome.status()).isEqualTo(RelayStatus.IGNORED);
        assertThat(stores.transcripts().listByConversation(conversation.id())).isEmpty();
        assertThat(oracle.ownerContexts).isEmpty();
    }

    @Test
    void shouldPushQuickRepliesToSubscribers() throws Exception {
        relay.handleExternalEvent("""
            {"id": "evt-11", "type": "Text", "text": "Was this helpful?", "direction": "Outbound",
             "channel": {"to": {"id": "user+%s@ex.com"}},
             "content": [{"contentType": "QuickReply", "quickReply": {"text": "Yes", "payload": "yes"}}]}
            """.formatted(conversation.id()));

        MessageEvent event = subscriber.events().get(0);
        assertThat(event.quickReplies()).extracting(r -> r.text()).containsExactly("Yes");
    }

    private static String agentText(String eventId, String recipient, String text) {
        return """
            {"id": "%s", "type": "Text", "text": "%s", "direction": "Outbound",
             "channel": {"to": {"id": "%s"}, "from": {"nickname": "Agent"}}}
            """.formatted(eventId, text, recipient);
    }
}
