package io.switchboard.core.fanout;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process rooms keyed by conversation id. Membership changes and
 * broadcasts may run concurrently from any thread.
 */
public final class ConversationRooms implements RealtimeFanout {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationRooms.class);

    private final Map<String, Set<Subscriber>> rooms = new ConcurrentHashMap<>();

    @Override
    public void join(String conversationId, Subscriber subscriber) {
        rooms.compute(conversationId, (id, members) -> {
            Set<Subscriber> room = members == null ? ConcurrentHashMap.newKeySet() : members;
            room.add(subscriber);
            return room;
        });
        LOG.debug("Subscriber {} joined conversation {}", subscriber.id(), conversationId);
    }

    @Override
    public void leave(String conversationId, Subscriber subscriber) {
        rooms.computeIfPresent(conversationId, (id, members) -> {
            members.remove(subscriber);
            return members.isEmpty() ? null : members;
        });
    }

    @Override
    public void leaveAll(Subscriber subscriber) {
        for (String conversationId : List.copyOf(rooms.keySet())) {
            leave(conversationId, subscriber);
        }
    }

    @Override
    public int broadcast(MessageEvent event) {
        Set<Subscriber> members = rooms.get(event.conversationId());
        if (members == null || members.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (Subscriber subscriber : List.copyOf(members)) {
            try {
                subscriber.deliver(event);
                delivered++;
            } catch (Exception e) {
                LOG.warn("Dropping subscriber {} from conversation {} after failed delivery", subscriber.id(), event.conversationId(), e);
                leave(event.conversationId(), subscriber);
            }
        }
        return delivered;
    }

    public int subscriberCount(String conversationId) {
        Set<Subscriber> members = rooms.get(conversationId);
        return members == null ? 0 : members.size();
    }
}
