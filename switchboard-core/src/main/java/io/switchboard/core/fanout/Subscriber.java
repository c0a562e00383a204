package io.switchboard.core.fanout;

import java.io.IOException;

/**
 * A live connection listening to one or more conversations.
 */
public interface Subscriber {
    String id();

    void deliver(MessageEvent event) throws IOException;
}
