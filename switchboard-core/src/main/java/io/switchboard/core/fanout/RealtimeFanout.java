package io.switchboard.core.fanout;

/**
 * Pushes persisted messages to subscribers of a conversation. Delivery is
 * best effort: a failing subscriber never fails the caller.
 */
public interface RealtimeFanout {
    void join(String conversationId, Subscriber subscriber);

    void leave(String conversationId, Subscriber subscriber);

    void leaveAll(Subscriber subscriber);

    /**
     * Returns the number of subscribers the event reached.
     */
    int broadcast(MessageEvent event);
}
