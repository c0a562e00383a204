package io.switchboard.core.correlation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.switchboard.core.conversation.ConversationStore;
import io.switchboard.core.error.ConversationClosedException;
import io.switchboard.core.error.ConversationNotFoundException;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.Owner;
import io.switchboard.core.routing.RelayStores;
import io.switchboard.core.testing.TestStores;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorrelationRegistryTest {

    @TempDir
    Path tempDir;

    private RelayStores stores;
    private CountingConversationStore conversations;
    private Conversation conversation;

    @BeforeEach
    void setUp() throws IOException {
        stores = TestStores.sqlite(tempDir);
        conversations = new CountingConversationStore(stores.conversations());
        Owner owner = stores.owners().register("user@ex.com");
        conversation = stores.conversations().create(owner.id(), "Refund");
    }

    @Test
    void shouldCreateSessionOnceAndReuseIt() throws Exception {
        AtomicInteger ids = new AtomicInteger();
        CorrelationRegistry registry = new CorrelationRegistry(conversations, () -> "session-" + ids.incrementAndGet());

        ExternalSession first = registry.ensureSession(conversation.id());
        ExternalSession second = registry.ensureSession(conversation.id());

        assertThat(first.sessionId()).isEqualTo("session-1");
        assertThat(second).isEqualTo(first);
        assertThat(first.active()).isTrue();
        assertThat(conversations.assignments.get()).isEqualTo(1);
        assertThat(registry.activeSession(conversation.id())).contains(first);
    }

    @Test
    void shouldConvergeOnWinnerWhenAnotherWriterAssignedFirst() throws Exception {
        stores.conversations().assignExternalSession(conversation.id(), "winner");
        ConversationStore stale = new CountingConversationStore(stores.conversations()) {
            @Override
            public Optional<Conversation> find(String conversationId) throws IOException {
                Optional<Conversation> current = super.find(conversationId);
                if (findCalls.getAndIncrement() == 0) {
                    return current.map(c -> new Conversation(
                        c.id(), c.ownerId(), c.title(), c.status(), null, c.externalActive(), c.createdAt(), c.updatedAt()
                    ));
                }
                return current;
            }
        };
        CorrelationRegistry registry = new CorrelationRegistry(stale, () -> "loser");

        assertThat(registry.ensureSession(conversation.id()).sessionId()).isEqualTo("winner");
    }

    @Test
    void shouldNotOpenSessionForClosedConversation() throws Exception {
        stores.conversations().close(conversation.id());
        CorrelationRegistry registry = new CorrelationRegistry(conversations, () -> "late");

        assertThatThrownBy(() -> registry.ensureSession(conversation.id()))
            .isInstanceOf(ConversationClosedException.class);
        assertThat(conversations.assignments.get()).isZero();
        assertThat(stores.conversations().find(conversation.id()).orElseThrow().hasExternalSession()).isFalse();
    }

    @Test
    void shouldReportStoredForwardingSwitch() throws Exception {
        CorrelationRegistry registry = new CorrelationRegistry(conversations, () -> "session-1");
        registry.setForwarding(conversation.id(), false);

        ExternalSession session = registry.ensureSession(conversation.id());

        assertThat(session.sessionId()).isEqualTo("session-1");
        assertThat(session.active()).isFalse();
        assertThat(registry.activeSession(conversation.id())).isEmpty();

        registry.setForwarding(conversation.id(), true);
        assertThat(registry.ensureSession(conversation.id()).active()).isTrue();
        assertThatThrownBy(() -> registry.setForwarding("missing", false))
            .isInstanceOf(ConversationNotFoundException.class);
    }

    @Test
    void shouldFailForUnknownConversation() {
        CorrelationRegistry registry = new CorrelationRegistry(conversations);

        assertThatThrownBy(() -> registry.ensureSession("missing"))
            .isInstanceOf(ConversationNotFoundException.class);
    }

    @Test
    void shouldReportNoActiveSessionBeforeAssignment() throws Exception {
        CorrelationRegistry registry = new CorrelationRegistry(conversations);

        assertThat(registry.activeSession(conversation.id())).isEmpty();
        assertThat(registry.activeSession("missing")).isEmpty();
    }

    @Test
    void shouldResolveAddressesItHandsOut() {
        CorrelationRegistry registry = new CorrelationRegistry(conversations);

        String address = registry.addressFor(conversation.id(), "user@ex.com");

        assertThat(registry.resolve(address)).isEqualTo(new AddressTag("user@ex.com", conversation.id()));
    }

    static class CountingConversationStore implements ConversationStore {
        final AtomicInteger assignments = new AtomicInteger();
        final AtomicInteger findCalls = new AtomicInteger();
        private final ConversationStore delegate;

        CountingConversationStore(ConversationStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Conversation create(String ownerId, String title) throws IOException {
            return delegate.create(ownerId, title);
        }

        @Override
        public Optional<Conversation> find(String conversationId) throws IOException {
            return delegate.find(conversationId);
        }

        @Override
        public List<Conversation> listByOwner(String ownerId) throws IOException {
            return delegate.listByOwner(ownerId);
        }

        @Override
        public boolean close(String conversationId) throws IOException {
            return delegate.close(conversationId);
        }

        @Override
        public boolean assignExternalSession(String conversationId, String externalSessionId) throws IOException {
            assignments.incrementAndGet();
            return delegate.assignExternalSession(conversationId, externalSessionId);
        }

        @Override
        public boolean setExternalActive(String conversationId, boolean active) throws IOException {
            return delegate.setExternalActive(conversationId, active);
        }

        @Override
        public boolean delete(String conversationId) throws IOException {
            return delegate.delete(conversationId);
        }
    }
}
