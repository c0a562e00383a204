package io.switchboard.core.error;

/**
 * Raised by forwarders when the live-agent platform rejects or cannot be
 * reached. Routers catch it; it never reaches the API boundary.
 */
public final class ExternalDeliveryException extends RelayException {

    public ExternalDeliveryException(String message) {
        super("external_delivery_failed", 502, message);
    }

    public ExternalDeliveryException(String message, Throwable cause) {
        super("external_delivery_failed", 502, message, cause);
    }
}
