package io.switchboard.core.testing;

import io.switchboard.core.correlation.ExternalSession;
import io.switchboard.core.error.ExternalDeliveryException;
import io.switchboard.core.external.ExternalForwarder;
import io.switchboard.core.external.ExternalSendResult;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingForwarder implements ExternalForwarder {
    public record Sent(String fromAddress, String toAddress, String text, String sessionId) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public RecordingForwarder failing() {
        this.failing = true;
        return this;
    }

    @Override
    public String name() {
        return "recording";
    }

    @Override
    public ExternalSendResult send(String fromAddress, String toAddress, String text, ExternalSession session) {
        if (failing) {
            throw new ExternalDeliveryException("live agent platform unavailable");
        }
        sent.add(new Sent(fromAddress, toAddress, text, session.sessionId()));
        return new ExternalSendResult("ext-" + sent.size());
    }

    public List<Sent> sent() {
        return sent;
    }
}
