package io.switchboard.core.model;

public record QuickReply(String text, String payload) {

    public QuickReply {
        text = text == null ? "" : text;
        payload = payload == null || payload.isBlank() ? text : payload;
    }
}
