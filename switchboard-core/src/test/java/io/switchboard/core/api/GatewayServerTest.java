package io.switchboard.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.correlation.CorrelationRegistry;
import io.switchboard.core.external.VendorEventParser;
import io.switchboard.core.fanout.ConversationRooms;
import io.switchboard.core.memory.MemoryExtractor;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.Owner;
import io.switchboard.core.oracle.OraclePrompts;
import io.switchboard.core.oracle.ReplyComposer;
import io.switchboard.core.oracle.RoutingDecision;
import io.switchboard.core.routing.InboundRouter;
import io.switchboard.core.routing.OutboundRelay;
import io.switchboard.core.routing.RelaySettings;
import io.switchboard.core.routing.RelayStores;
import io.switchboard.core.testing.RecordingForwarder;
import io.switchboard.core.testing.ScriptedProvider;
import io.switchboard.core.testing.StubOracle;
import io.switchboard.core.testing.TestStores;
import io.switchboard.core.tool.ToolRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GatewayServerTest {
    private static final String WEBHOOK_TOKEN = "hook-secret";

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private RelayStores stores;
    private StubOracle oracle;
    private RecordingForwarder forwarder;
    private ConversationRooms fanout;
    private GatewayServer server;
    private Owner alice;
    private Owner bob;

    @BeforeEach
    void setUp() throws Exception {
        stores = TestStores.sqlite(tempDir);
        alice = stores.owners().register("alice@ex.com");
        bob = stores.owners().register("bob@ex.com");
        oracle = new StubOracle();
        forwarder = new RecordingForwarder();
        fanout = new ConversationRooms();
        CorrelationRegistry registry = new CorrelationRegistry(stores.conversations());
        RelaySettings settings = new RelaySettings(5, "deployment-1");
        InboundRouter inbound = new InboundRouter(
            stores,
            oracle,
            new ReplyComposer(new ScriptedProvider(), "gpt-test", OraclePrompts.defaults(), new ToolRegistry()),
            MemoryExtractor.disabled(),
            registry,
            forwarder,
            fanout,
            settings
        );
        OutboundRelay outbound = new OutboundRelay(stores, new VendorEventParser(), oracle, registry, forwarder, fanout, settings);
        server = new GatewayServer("127.0.0.1", 0, WEBHOOK_TOKEN, List.of(), stores, inbound, outbound, fanout);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void shouldAnswerHealthWithoutToken() throws Exception {
        HttpResponse<String> response = send(get("/healthz", null));

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).path("status").asText()).isEqualTo("ok");
    }

    @Test
    void shouldRejectMissingOrUnknownToken() throws Exception {
        assertThat(send(get("/conversations", null)).statusCode()).isEqualTo(401);

        HttpResponse<String> unknown = send(get("/conversations", "not-a-token"));
        assertThat(unknown.statusCode()).isEqualTo(401);
        assertThat(json(unknown).path("error").asText()).isEqualTo("unauthorized");
    }

    @Test
    void shouldRunConversationLifecycle() throws Exception {
        HttpResponse<String> created = send(post("/conversations", alice.apiToken(), "{\"title\":\"Printer\"}"));
        assertThat(created.statusCode()).isEqualTo(201);
        String id = json(created).path("id").asText();
        assertThat(json(created).path("status").asText()).isEqualTo("open");

        HttpResponse<String> posted = send(post("/conversations/" + id + "/messages", alice.apiToken(), "{\"content\":\"hello\"}"));
        assertThat(posted.statusCode()).isEqualTo(200);
        JsonNode postedBody = json(posted);
        assertThat(postedBody.path("accepted").asBoolean()).isTrue();
        assertThat(postedBody.path("messages")).hasSize(2);
        assertThat(postedBody.path("messages").get(1).path("content").asText()).isEqualTo(RoutingDecision.FALLBACK_USER_TEXT);
        assertThat(postedBody.path("messages").get(1).path("origin").asText()).isEqualTo("local_system");

        JsonNode listed = json(send(get("/conversations", alice.apiToken())));
        assertThat(listed.path("conversations")).hasSize(1);
        assertThat(listed.path("conversations").get(0).path("latest_message").path("content").asText())
            .isEqualTo(RoutingDecision.FALLBACK_USER_TEXT);

        JsonNode detail = json(send(get("/conversations/" + id, alice.apiToken())));
        assertThat(detail.path("title").asText()).isEqualTo("Printer");
        assertThat(detail.path("messages")).hasSize(2);

        JsonNode closed = json(send(post("/conversations/" + id + "/close", alice.apiToken(), "")));
        assertThat(closed.path("status").asText()).isEqualTo("closed");
        assertThat(closed.path("changed").asBoolean()).isTrue();

        JsonNode afterClose = json(send(post("/conversations/" + id + "/messages", alice.apiToken(), "{\"content\":\"anyone?\"}")));
        assertThat(afterClose.path("accepted").asBoolean()).isFalse();
        assertThat(afterClose.path("messages")).isEmpty();

        HttpResponse<String> deleted = send(delete("/conversations/" + id, alice.apiToken()));
        assertThat(json(deleted).path("deleted").asBoolean()).isTrue();
        assertThat(send(get("/conversations/" + id, alice.apiToken())).statusCode()).isEqualTo(404);
    }

    @Test
    void shouldKeepOwnersApart() throws Exception {
        Conversation conversation = stores.conversations().create(alice.id(), null);

        HttpResponse<String> response = send(get("/conversations/" + conversation.id() + "/messages", bob.apiToken()));

        assertThat(response.statusCode()).isEqualTo(403);
        assertThat(json(response).path("error").asText()).isEqualTo("ownership_mismatch");
        assertThat(json(send(get("/conversations", bob.apiToken()))).path("conversations")).isEmpty();
    }

    @Test
    void shouldRejectBlankMessageContent() throws Exception {
        Conversation conversation = stores.conversations().create(alice.id(), null);

        HttpResponse<String> response = send(post("/conversations/" + conversation.id() + "/messages", alice.apiToken(), "{\"content\":\"  \"}"));

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(stores.transcripts().listByConversation(conversation.id())).isEmpty();
    }

    @Test
    void shouldManageMemories() throws Exception {
        Conversation conversation = stores.conversations().create(alice.id(), null);
        String base = "/conversations/" + conversation.id() + "/memories";

        HttpResponse<String> added = send(post(base, alice.apiToken(), "{\"content\":\"Prefers email\"}"));
        assertThat(added.statusCode()).isEqualTo(201);
        String memoryId = json(added).path("id").asText();

        assertThat(json(send(get(base, alice.apiToken()))).path("memories")).hasSize(1);
        assertThat(send(delete("/memories/" + memoryId, bob.apiToken())).statusCode()).isEqualTo(403);
        assertThat(json(send(delete("/memories/" + memoryId, alice.apiToken()))).path("deleted").asBoolean()).isTrue();
        assertThat(send(delete("/memories/" + memoryId, alice.apiToken())).statusCode()).isEqualTo(404);
    }

    @Test
    void shouldGuardWebhookAndReportRelayStatus() throws Exception {
        Conversation conversation = stores.conversations().create(alice.id(), null);
        stores.conversations().assignExternalSession(conversation.id(), "session-1");
        String payload = """
            {"id": "evt-1", "type": "Text", "text": "Hi, this is Sam from support.", "direction": "Outbound",
             "channel": {"to": {"id": "alice+%s@ex.com"}}}
            """.formatted(conversation.id());

        assertThat(send(webhook(payload, "wrong")).statusCode()).isEqualTo(401);

        HttpResponse<String> first = send(webhook(payload, WEBHOOK_TOKEN));
        assertThat(first.statusCode()).isEqualTo(200);
        assertThat(json(first).path("status").asText()).isEqualTo("processed");
        assertThat(json(first).path("conversation_id").asText()).isEqualTo(conversation.id());

        assertThat(json(send(webhook(payload, WEBHOOK_TOKEN))).path("status").asText()).isEqualTo("duplicate");

        HttpResponse<String> spoofed = send(webhook(payload.replace("alice+", "bob+"), WEBHOOK_TOKEN));
        assertThat(spoofed.statusCode()).isEqualTo(403);

        HttpResponse<String> malformed = send(webhook("{nope", WEBHOOK_TOKEN));
        assertThat(malformed.statusCode()).isEqualTo(400);
    }

    @Test
    void shouldPushNewMessagesToJoinedSocket() throws Exception {
        Conversation conversation = stores.conversations().create(alice.id(), null);
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        WebSocket ws = connect("/ws?token=" + alice.apiToken(), frames, new CompletableFuture<>());

        ws.sendText("{\"type\":\"ping\"}", true).join();
        assertThat(frames.poll(5, TimeUnit.SECONDS)).contains("\"type\":\"pong\"");

        ws.sendText("{\"type\":\"join\",\"conversation_id\":\"" + conversation.id() + "\"}", true).join();
        assertThat(frames.poll(5, TimeUnit.SECONDS)).contains("\"type\":\"joined\"");

        send(post("/conversations/" + conversation.id() + "/messages", alice.apiToken(), "{\"content\":\"hello\"}"));

        JsonNode userFrame = mapper.readTree(frames.poll(5, TimeUnit.SECONDS));
        JsonNode replyFrame = mapper.readTree(frames.poll(5, TimeUnit.SECONDS));
        assertThat(userFrame.path("type").asText()).isEqualTo("new_message");
        assertThat(userFrame.path("message").path("content").asText()).isEqualTo("hello");
        assertThat(replyFrame.path("message").path("origin").asText()).isEqualTo("local_system");
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").join();
    }

    @Test
    void shouldLeaveJoinedRoomsWhenSocketCloses() throws Exception {
        Conversation joined = stores.conversations().create(alice.id(), null);
        Conversation other = stores.conversations().create(alice.id(), null);
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        WebSocket ws = connect("/ws?token=" + alice.apiToken(), frames, new CompletableFuture<>());

        ws.sendText("{\"type\":\"join\",\"conversation_id\":\"" + joined.id() + "\"}", true).join();
        assertThat(frames.poll(5, TimeUnit.SECONDS)).contains("\"type\":\"joined\"");
        assertThat(fanout.subscriberCount(joined.id())).isEqualTo(1);

        ws.sendText("{\"type\":\"leave\",\"conversation_id\":\"" + other.id() + "\"}", true).join();
        JsonNode notJoined = mapper.readTree(frames.poll(5, TimeUnit.SECONDS));
        assertThat(notJoined.path("error").asText()).isEqualTo("not_joined");

        ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").join();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (fanout.subscriberCount(joined.id()) > 0 && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(fanout.subscriberCount(joined.id())).isZero();
    }

    @Test
    void shouldSwitchLiveAgentForwardingPerConversation() throws Exception {
        Conversation conversation = stores.conversations().create(alice.id(), null);
        String path = "/conversations/" + conversation.id() + "/forwarding";

        assertThat(send(post(path, alice.apiToken(), "{\"active\":\"no\"}")).statusCode()).isEqualTo(400);
        assertThat(send(post(path, bob.apiToken(), "{\"active\":false}")).statusCode()).isEqualTo(403);

        HttpResponse<String> switched = send(post(path, alice.apiToken(), "{\"active\":false}"));
        assertThat(switched.statusCode()).isEqualTo(200);
        assertThat(json(switched).path("forwarding").asBoolean()).isFalse();

        oracle.routeWith(new RoutingDecision(true, true, "One moment please.", "Customer wants an agent.", "escalate"));
        JsonNode posted = json(send(post("/conversations/" + conversation.id() + "/messages", alice.apiToken(), "{\"content\":\"agent\"}")));

        assertThat(forwarder.sent()).isEmpty();
        assertThat(posted.path("messages")).hasSize(2);
        assertThat(posted.path("messages").get(1).path("content").asText()).isEqualTo("One moment please.");
    }

    @Test
    void shouldRefuseJoiningAnotherOwnersConversation() throws Exception {
        Conversation conversation = stores.conversations().create(alice.id(), null);
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        WebSocket ws = connect("/ws?token=" + bob.apiToken(), frames, new CompletableFuture<>());

        ws.sendText("{\"type\":\"join\",\"conversation_id\":\"" + conversation.id() + "\"}", true).join();
        JsonNode frame = mapper.readTree(frames.poll(5, TimeUnit.SECONDS));

        assertThat(frame.path("type").asText()).isEqualTo("error");
        assertThat(frame.path("error").asText()).isEqualTo("ownership_mismatch");
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").join();
    }

    @Test
    void shouldCloseSocketWithoutValidToken() throws Exception {
        CompletableFuture<Integer> closed = new CompletableFuture<>();

        connect("/ws?token=bogus", new LinkedBlockingQueue<>(), closed);

        assertThat(closed.get(5, TimeUnit.SECONDS)).isNotNull();
    }

    private WebSocket connect(String path, BlockingQueue<String> frames, CompletableFuture<Integer> closed) {
        return client.newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .buildAsync(URI.create("ws://127.0.0.1:" + server.port() + path), new WebSocket.Listener() {
                @Override
                public void onOpen(WebSocket webSocket) {
                    webSocket.request(1);
                }

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    frames.add(data.toString());
                    webSocket.request(1);
                    return null;
                }

                @Override
                public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                    closed.complete(statusCode);
                    return null;
                }

                @Override
                public void onError(WebSocket webSocket, Throwable error) {
                    closed.complete(-1);
                }
            })
            .join();
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }

    private HttpRequest.Builder request(String path, String token) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
            .timeout(Duration.ofSeconds(10));
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private HttpRequest get(String path, String token) {
        return request(path, token).GET().build();
    }

    private HttpRequest delete(String path, String token) {
        return request(path, token).DELETE().build();
    }

    private HttpRequest post(String path, String token, String body) {
        return request(path, token)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
    }

    private HttpRequest webhook(String body, String token) {
        return request("/webhooks/messages", null)
            .header("X-Webhook-Token", token)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
    }
}
