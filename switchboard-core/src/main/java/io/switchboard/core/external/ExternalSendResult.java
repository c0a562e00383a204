package io.switchboard.core.external;

/**
 * Outcome of a successful send. The platform may not return an id.
 */
public record ExternalSendResult(String externalMessageId) {
}
