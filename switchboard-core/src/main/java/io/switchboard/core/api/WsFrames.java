package io.switchboard.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.switchboard.core.fanout.MessageEvent;
import java.util.List;
import java.util.Map;

/**
 * Realtime channel frames. Clients send {@code join}, {@code leave} and
 * {@code ping}; the server answers with {@code joined}, {@code left},
 * {@code pong} or {@code error} and pushes {@code new_message}.
 */
final class WsFrames {

    private WsFrames() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Inbound(String type, @JsonProperty("conversation_id") String conversationId) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Outbound(
        String type,
        @JsonProperty("conversation_id") String conversationId,
        Map<String, Object> message,
        @JsonProperty("quick_replies") List<Map<String, String>> quickReplies,
        String error
    ) {

        static Outbound newMessage(MessageEvent event) {
            return new Outbound(
                MessageEvent.TYPE,
                event.conversationId(),
                ApiViews.message(event.message()),
                ApiViews.quickReplies(event.quickReplies()),
                null
            );
        }

        static Outbound ack(String type, String conversationId) {
            return new Outbound(type, conversationId, null, null, null);
        }

        static Outbound error(String conversationId, String code) {
            return new Outbound("error", conversationId, null, null, code);
        }
    }
}
