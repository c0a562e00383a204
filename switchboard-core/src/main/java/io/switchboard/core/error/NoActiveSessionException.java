package io.switchboard.core.error;

public final class NoActiveSessionException extends RelayException {

    public NoActiveSessionException(String conversationId) {
        super("no_active_session", 409, "Conversation " + conversationId + " has no active external session");
    }
}
