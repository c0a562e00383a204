package io.switchboard.core.api;

import io.switchboard.core.model.Owner;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State of one realtime connection: who it belongs to and which conversation
 * rooms it has joined. Lives exactly as long as the socket.
 */
public final class ConnectionContext {
    private final String connectionId;
    private final Owner owner;
    private final Set<String> rooms;

    public ConnectionContext(String connectionId, Owner owner) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId must not be null");
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.rooms = ConcurrentHashMap.newKeySet();
    }

    public String connectionId() {
        return connectionId;
    }

    public Owner owner() {
        return owner;
    }

    public boolean joined(String conversationId) {
        return rooms.contains(conversationId);
    }

    void markJoined(String conversationId) {
        rooms.add(conversationId);
    }

    void markLeft(String conversationId) {
        rooms.remove(conversationId);
    }

    public Set<String> rooms() {
        return Set.copyOf(rooms);
    }
}
