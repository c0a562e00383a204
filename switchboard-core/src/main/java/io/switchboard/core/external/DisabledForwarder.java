package io.switchboard.core.external;

import io.switchboard.core.correlation.ExternalSession;
import io.switchboard.core.error.ExternalDeliveryException;

/**
 * Used when no live-agent credentials are configured. Every send fails, so
 * routers fall back to answering the customer themselves.
 */
public final class DisabledForwarder implements ExternalForwarder {
    private final String reason;

    public DisabledForwarder(String reason) {
        this.reason = reason == null || reason.isBlank() ? "forwarder is disabled" : reason;
    }

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public ExternalSendResult send(String fromAddress, String toAddress, String text, ExternalSession session) {
        throw new ExternalDeliveryException("Live agent forwarding is not configured (" + reason + ")");
    }
}
