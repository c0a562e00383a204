package io.switchboard.core.error;

public final class ConversationNotFoundException extends RelayException {

    public ConversationNotFoundException(String conversationId) {
        super("not_found", 404, "Conversation " + conversationId + " not found");
    }
}
