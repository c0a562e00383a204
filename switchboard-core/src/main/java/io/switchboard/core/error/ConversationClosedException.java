package io.switchboard.core.error;

public final class ConversationClosedException extends RelayException {

    public ConversationClosedException(String conversationId) {
        super("conversation_closed", 409, "Conversation " + conversationId + " is closed");
    }
}
