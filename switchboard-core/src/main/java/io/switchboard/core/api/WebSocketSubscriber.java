package io.switchboard.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.fanout.MessageEvent;
import io.switchboard.core.fanout.Subscriber;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import java.io.IOException;

/**
 * Fanout subscriber backed by one WebSocket connection.
 */
final class WebSocketSubscriber implements Subscriber {
    private final ConnectionContext context;
    private final WebSocketChannel channel;
    private final ObjectMapper mapper;

    WebSocketSubscriber(ConnectionContext context, WebSocketChannel channel, ObjectMapper mapper) {
        this.context = context;
        this.channel = channel;
        this.mapper = mapper;
    }

    @Override
    public String id() {
        return context.connectionId();
    }

    @Override
    public void deliver(MessageEvent event) throws IOException {
        send(WsFrames.Outbound.newMessage(event));
    }

    void send(WsFrames.Outbound frame) throws IOException {
        if (!channel.isOpen()) {
            throw new IOException("Connection " + context.connectionId() + " is closed");
        }
        WebSockets.sendText(mapper.writeValueAsString(frame), channel, null);
    }

    ConnectionContext context() {
        return context;
    }
}
