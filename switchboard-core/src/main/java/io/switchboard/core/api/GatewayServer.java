package io.switchboard.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.switchboard.core.error.ConversationNotFoundException;
import io.switchboard.core.error.InvalidPayloadException;
import io.switchboard.core.error.OwnershipMismatchException;
import io.switchboard.core.error.RelayException;
import io.switchboard.core.error.UnauthorizedException;
import io.switchboard.core.fanout.RealtimeFanout;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.MemoryEntry;
import io.switchboard.core.model.Owner;
import io.switchboard.core.model.TranscriptMessage;
import io.switchboard.core.routing.InboundOutcome;
import io.switchboard.core.routing.InboundRouter;
import io.switchboard.core.routing.OutboundRelay;
import io.switchboard.core.routing.RelayOutcome;
import io.switchboard.core.routing.RelayStores;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * HTTP and WebSocket front door: the owner-facing conversation API, the
 * live-agent webhook and the realtime channel.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");
    private static final String WEBHOOK_TOKEN_HEADER = "X-Webhook-Token";
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final String webhookToken;
    private final List<String> corsOrigins;
    private final RelayStores stores;
    private final InboundRouter inboundRouter;
    private final OutboundRelay outboundRelay;
    private final RealtimeFanout fanout;
    private final RequestAuthenticator authenticator;

    private final ExecutorService executor;
    private final AtomicBoolean running;
    private final Map<String, WebSocketSubscriber> connections;
    private Undertow server;
    private int actualPort;

    public GatewayServer(
        String host,
        int port,
        String webhookToken,
        List<String> corsOrigins,
        RelayStores stores,
        InboundRouter inboundRouter,
        OutboundRelay outboundRelay,
        RealtimeFanout fanout
    ) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.webhookToken = webhookToken == null ? "" : webhookToken.trim();
        this.corsOrigins = corsOrigins == null ? List.of() : List.copyOf(corsOrigins);
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.inboundRouter = Objects.requireNonNull(inboundRouter, "inboundRouter must not be null");
        this.outboundRelay = Objects.requireNonNull(outboundRelay, "outboundRelay must not be null");
        this.fanout = Objects.requireNonNull(fanout, "fanout must not be null");
        this.authenticator = new RequestAuthenticator(stores.owners());

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.executor = Executors.newCachedThreadPool();
        this.running = new AtomicBoolean(false);
        this.connections = new ConcurrentHashMap<>();
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        RoutingHandler routes = Handlers.routing()
            .get("/healthz", this::handleHealth)
            .post("/conversations", authenticated(this::handleCreateConversation))
            .get("/conversations", authenticated(this::handleListConversations))
            .get("/conversations/{id}", authenticated(this::handleGetConversation))
            .delete("/conversations/{id}", authenticated(this::handleDeleteConversation))
            .post("/conversations/{id}/close", authenticated(this::handleCloseConversation))
            .post("/conversations/{id}/forwarding", authenticated(this::handleSetForwarding))
            .get("/conversations/{id}/messages", authenticated(this::handleListMessages))
            .post("/conversations/{id}/messages", authenticated(this::handlePostMessage))
            .get("/conversations/{id}/memories", authenticated(this::handleListMemories))
            .post("/conversations/{id}/memories", authenticated(this::handleAddMemory))
            .delete("/memories/{id}", authenticated(this::handleDeleteMemory))
            .post("/webhooks/messages", blocking(this::handleWebhook))
            .get("/ws", Handlers.websocket(this::onWebSocketConnect))
            .setFallbackHandler(exchange -> sendJson(exchange, 404, Map.of("error", "not_found")))
            .setInvalidMethodHandler(exchange -> sendJson(exchange, 405, Map.of("error", "method_not_allowed")));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    private void handleWithCors(HttpHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        if (origin.isBlank() || !isAllowedCorsOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,DELETE,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isAllowedCorsOrigin(String origin) {
        if (corsOrigins.contains(origin)) {
            return true;
        }
        try {
            URI uri = URI.create(origin);
            String scheme = uri.getScheme();
            String hostName = uri.getHost();
            if (scheme == null || hostName == null) {
                return false;
            }
            return "http".equalsIgnoreCase(scheme)
                && ("localhost".equalsIgnoreCase(hostName) || "127.0.0.1".equals(hostName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
        connections.values().forEach(subscriber -> fanout.leaveAll(subscriber));
        connections.clear();
        executor.shutdownNow();
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleCreateConversation(HttpServerExchange exchange, Owner owner) throws IOException {
        JsonNode body = readJsonBody(exchange);
        String title = body.path("title").asText("").trim();
        Conversation created = stores.conversations().create(owner.id(), title.isBlank() ? null : title);
        LOG.info("Owner {} created conversation {}", owner.id(), created.id());
        sendJson(exchange, 201, ApiViews.conversation(created));
    }

    private void handleListConversations(HttpServerExchange exchange, Owner owner) throws IOException {
        List<Conversation> conversations = stores.conversations().listByOwner(owner.id());
        Map<String, TranscriptMessage> latest = stores.transcripts().latestPerConversation(owner.id());
        List<Map<String, Object>> views = new ArrayList<>(conversations.size());
        for (Conversation conversation : conversations) {
            Map<String, Object> view = ApiViews.conversation(conversation);
            TranscriptMessage last = latest.get(conversation.id());
            view.put("latest_message", last == null ? null : ApiViews.message(last));
            views.add(view);
        }
        sendJson(exchange, 200, Map.of("conversations", views));
    }

    private void handleGetConversation(HttpServerExchange exchange, Owner owner) throws IOException {
        Conversation conversation = ownedConversation(exchange, owner);
        Map<String, Object> view = ApiViews.conversation(conversation);
        view.put("messages", ApiViews.messages(stores.transcripts().listByConversation(conversation.id())));
        sendJson(exchange, 200, view);
    }

    private void handleDeleteConversation(HttpServerExchange exchange, Owner owner) throws IOException {
        Conversation conversation = ownedConversation(exchange, owner);
        boolean deleted = stores.conversations().delete(conversation.id());
        sendJson(exchange, 200, Map.of("deleted", deleted));
    }

    private void handleCloseConversation(HttpServerExchange exchange, Owner owner) throws IOException {
        Conversation conversation = ownedConversation(exchange, owner);
        boolean closed = stores.conversations().close(conversation.id());
        Conversation current = stores.conversations().find(conversation.id())
            .orElseThrow(() -> new ConversationNotFoundException(conversation.id()));
        Map<String, Object> view = ApiViews.conversation(current);
        view.put("changed", closed);
        sendJson(exchange, 200, view);
    }

    private void handleSetForwarding(HttpServerExchange exchange, Owner owner) throws IOException {
        Conversation conversation = ownedConversation(exchange, owner);
        JsonNode active = readJsonBody(exchange).path("active");
        if (!active.isBoolean()) {
            throw new InvalidPayloadException("active must be true or false");
        }
        stores.conversations().setExternalActive(conversation.id(), active.booleanValue());
        LOG.info("Owner {} switched live agent forwarding {} for conversation {}",
            owner.id(), active.booleanValue() ? "on" : "off", conversation.id());
        Conversation current = stores.conversations().find(conversation.id())
            .orElseThrow(() -> new ConversationNotFoundException(conversation.id()));
        Map<String, Object> view = ApiViews.conversation(current);
        view.put("forwarding", current.externalActive());
        sendJson(exchange, 200, view);
    }

    private void handleListMessages(HttpServerExchange exchange, Owner owner) throws IOException {
        Conversation conversation = ownedConversation(exchange, owner);
        List<TranscriptMessage> messages = stores.transcripts().listByConversation(conversation.id());
        sendJson(exchange, 200, Map.of("messages", ApiViews.messages(messages)));
    }

    private void handlePostMessage(HttpServerExchange exchange, Owner owner) throws IOException {
        Conversation conversation = ownedConversation(exchange, owner);
        JsonNode body = readJsonBody(exchange);
        String content = body.path("content").asText("").trim();
        if (content.isBlank()) {
            throw new InvalidPayloadException("Message content must not be blank");
        }
        InboundOutcome outcome = inboundRouter.handleUserMessage(conversation.id(), content, owner.email());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("conversation_id", conversation.id());
        response.put("accepted", outcome.accepted());
        response.put("messages", ApiViews.messages(outcome.messages()));
        sendJson(exchange, 200, response);
    }

    private void handleListMemories(HttpServerExchange exchange, Owner owner) throws IOException {
        Conversation conversation = ownedConversation(exchange, owner);
        List<Map<String, Object>> views = new ArrayList<>();
        for (MemoryEntry entry : stores.memories().list(conversation.id())) {
            views.add(ApiViews.memory(entry));
        }
        sendJson(exchange, 200, Map.of("memories", views));
    }

    private void handleAddMemory(HttpServerExchange exchange, Owner owner) throws IOException {
        Conversation conversation = ownedConversation(exchange, owner);
        JsonNode body = readJsonBody(exchange);
        String content = body.path("content").asText("").trim();
        if (content.isBlank()) {
            throw new InvalidPayloadException("Memory content must not be blank");
        }
        sendJson(exchange, 201, ApiViews.memory(stores.memories().remember(conversation.id(), content)));
    }

    private void handleDeleteMemory(HttpServerExchange exchange, Owner owner) throws IOException {
        Optional<MemoryEntry> entry = stores.memories().find(pathParam(exchange, "id"));
        if (entry.isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        requireOwner(entry.get().conversationId(), owner);
        sendJson(exchange, 200, Map.of("deleted", stores.memories().forget(entry.get().id())));
    }

    private void handleWebhook(HttpServerExchange exchange) throws IOException {
        if (!webhookToken.isBlank() && !tokenMatches(header(exchange, WEBHOOK_TOKEN_HEADER))) {
            LOG.warn(SECURITY, "Rejected webhook call with missing or wrong {} header", WEBHOOK_TOKEN_HEADER);
            throw new UnauthorizedException("Invalid webhook token");
        }
        String raw = readBody(exchange);
        RelayOutcome outcome = outboundRelay.handleExternalEvent(raw);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
        response.put("conversation_id", outcome.conversationId());
        sendJson(exchange, 200, response);
    }

    private boolean tokenMatches(String presented) {
        return MessageDigest.isEqual(
            webhookToken.getBytes(StandardCharsets.UTF_8),
            presented.trim().getBytes(StandardCharsets.UTF_8)
        );
    }

    private Conversation ownedConversation(HttpServerExchange exchange, Owner owner) throws IOException {
        return requireOwner(pathParam(exchange, "id"), owner);
    }

    private Conversation requireOwner(String conversationId, Owner owner) throws IOException {
        Conversation conversation = stores.conversations().find(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        if (!conversation.ownerId().equals(owner.id())) {
            LOG.warn(SECURITY, "Owner {} attempted to access conversation {}", owner.id(), conversationId);
            throw new OwnershipMismatchException(conversationId);
        }
        return conversation;
    }

    private void onWebSocketConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String authorization = exchange.getRequestHeader("Authorization");
        String token = queryParam(exchange, "token");
        executor.submit(() -> {
            Owner owner;
            try {
                owner = authenticator.authenticate(authorization, token);
            } catch (RelayException | IOException e) {
                rejectConnection(channel, e);
                return;
            }
            ConnectionContext context = new ConnectionContext(UUID.randomUUID().toString(), owner);
            WebSocketSubscriber subscriber = new WebSocketSubscriber(context, channel, mapper);
            connections.put(context.connectionId(), subscriber);
            channel.getCloseSetter().set(closed -> {
                connections.remove(context.connectionId());
                for (String room : context.rooms()) {
                    fanout.leave(room, subscriber);
                }
                LOG.debug("Realtime connection {} closed", context.connectionId());
            });
            channel.getReceiveSetter().set(new AbstractReceiveListener() {
                @Override
                protected void onFullTextMessage(WebSocketChannel wsChannel, BufferedTextMessage message) {
                    handleInboundWs(subscriber, message.getData());
                }
            });
            channel.resumeReceives();
            LOG.debug("Realtime connection {} opened for owner {}", context.connectionId(), owner.id());
        });
    }

    private void rejectConnection(WebSocketChannel channel, Exception cause) {
        LOG.warn(SECURITY, "Rejected realtime connection: {}", cause.getMessage());
        try {
            channel.sendClose();
            channel.close();
        } catch (IOException e) {
            LOG.debug("Failed to close rejected realtime connection", e);
        }
    }

    private void handleInboundWs(WebSocketSubscriber subscriber, String raw) {
        executor.submit(() -> {
            ConnectionContext context = subscriber.context();
            try {
                WsFrames.Inbound inbound = mapper.readValue(raw, WsFrames.Inbound.class);
                String type = inbound.type() == null ? "" : inbound.type();
                switch (type) {
                    case "ping" -> subscriber.send(WsFrames.Outbound.ack("pong", null));
                    case "join" -> joinRoom(subscriber, requireConversationId(inbound));
                    case "leave" -> {
                        String conversationId = requireConversationId(inbound);
                        if (context.joined(conversationId)) {
                            fanout.leave(conversationId, subscriber);
                            context.markLeft(conversationId);
                            subscriber.send(WsFrames.Outbound.ack("left", conversationId));
                        } else {
                            subscriber.send(WsFrames.Outbound.error(conversationId, "not_joined"));
                        }
                    }
                    default -> subscriber.send(WsFrames.Outbound.error(inbound.conversationId(), "unknown_frame"));
                }
            } catch (JsonProcessingException e) {
                sendFrameQuietly(subscriber, WsFrames.Outbound.error(null, "invalid_payload"));
            } catch (RelayException e) {
                sendFrameQuietly(subscriber, WsFrames.Outbound.error(null, e.code()));
            } catch (Exception e) {
                LOG.warn("Failed to process realtime frame on connection {}", context.connectionId(), e);
            }
        });
    }

    private static String requireConversationId(WsFrames.Inbound inbound) {
        String conversationId = inbound.conversationId();
        if (conversationId == null || conversationId.isBlank()) {
            throw new InvalidPayloadException(inbound.type() + " requires conversation_id");
        }
        return conversationId;
    }

    private void joinRoom(WebSocketSubscriber subscriber, String conversationId) throws IOException {
        ConnectionContext context = subscriber.context();
        try {
            requireOwner(conversationId, context.owner());
        } catch (RelayException e) {
            subscriber.send(WsFrames.Outbound.error(conversationId, e.code()));
            return;
        }
        fanout.join(conversationId, subscriber);
        context.markJoined(conversationId);
        subscriber.send(WsFrames.Outbound.ack("joined", conversationId));
    }

    private void sendFrameQuietly(WebSocketSubscriber subscriber, WsFrames.Outbound frame) {
        try {
            subscriber.send(frame);
        } catch (IOException e) {
            LOG.debug("Dropped frame for closed connection {}", subscriber.id(), e);
        }
    }

    private HttpHandler authenticated(OwnerHandler handler) {
        return blocking(exchange -> {
            Owner owner = authenticator.authenticate(header(exchange, "Authorization"), queryParam(exchange, "token"));
            handler.handle(exchange, owner);
        });
    }

    private HttpHandler blocking(ExchangeHandler handler) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> runHandler(handler, exchange));
                return;
            }
            runHandler(handler, exchange);
        };
    }

    private void runHandler(ExchangeHandler handler, HttpServerExchange exchange) {
        try {
            handler.handle(exchange);
        } catch (RelayException e) {
            sendError(exchange, e);
        } catch (Exception e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendInternalError(exchange, e);
        }
    }

    private void sendError(HttpServerExchange exchange, RelayException error) {
        try {
            sendJson(exchange, error.httpStatus(), Map.of("error", error.code()));
        } catch (IOException e) {
            LOG.debug("Failed to send error response", e);
        }
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Failed to send error response", e);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private String readBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        return new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        String raw = readBody(exchange);
        if (raw.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Request body is not valid JSON", e);
        }
    }

    private String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? "" : values.getFirst();
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        return pathParam(exchange, key);
    }

    private String queryParam(WebSocketHttpExchange exchange, String key) {
        List<String> values = exchange.getRequestParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.get(0);
        return value == null ? "" : value;
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }

    @FunctionalInterface
    private interface OwnerHandler {
        void handle(HttpServerExchange exchange, Owner owner) throws Exception;
    }
}
