package io.switchboard.core.error;

public final class InvalidPayloadException extends RelayException {

    public InvalidPayloadException(String message) {
        super("invalid_payload", 400, message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super("invalid_payload", 400, message, cause);
    }
}
