package io.switchboard.core.error;

public final class OwnershipMismatchException extends RelayException {

    public OwnershipMismatchException(String conversationId) {
        super("ownership_mismatch", 403, "Caller does not own conversation " + conversationId);
    }
}
