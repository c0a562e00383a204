package io.switchboard.core.external;

import io.switchboard.core.model.QuickReply;
import java.util.List;

/**
 * One decoded webhook event from the live-agent platform. {@link #kind()}
 * tells which fields are meaningful: receipts and typing events carry no text.
 */
public record VendorEvent(
    VendorEventKind kind,
    String eventId,
    String recipientAddress,
    String senderLabel,
    String text,
    List<QuickReply> quickReplies,
    String direction
) {
    public static final String DIRECTION_OUTBOUND = "Outbound";
    public static final String DIRECTION_INBOUND = "Inbound";

    public VendorEvent {
        text = text == null ? "" : text.trim();
        quickReplies = quickReplies == null ? List.of() : List.copyOf(quickReplies);
    }

    /**
     * Events travelling from the customer towards the platform are echoes of
     * our own sends.
     */
    public boolean isEcho() {
        return DIRECTION_INBOUND.equalsIgnoreCase(direction);
    }

    public boolean isRelayable() {
        return kind.carriesText() && !isEcho() && !text.isEmpty();
    }
}
