package io.switchboard.core.external;

import io.switchboard.core.correlation.ExternalSession;

/**
 * Delivers text to the live-agent platform. Any non-success answer is raised
 * as {@link io.switchboard.core.error.ExternalDeliveryException}; sends are
 * never retried.
 */
public interface ExternalForwarder {
    String name();

    ExternalSendResult send(String fromAddress, String toAddress, String text, ExternalSession session);
}
