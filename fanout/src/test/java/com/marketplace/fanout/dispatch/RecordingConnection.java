package com.marketplace.fanout.dispatch;

import com.marketplace.shared.workflow.ActorRole;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory connection that records what it was sent.
 */
public class RecordingConnection implements Connection {

    public record Sent(String eventType, Object payload) {}

    private final ConnectionContext context;
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failing;

    public RecordingConnection(String connectionId, String principalId, ActorRole role) {
        this.context = new ConnectionContext(connectionId, principalId, role);
    }

    @Override
    public ConnectionContext context() {
        return context;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String eventType, Object payload) throws IOException {
        if (failing) {
            throw new IOException("broken pipe");
        }
        sent.add(new Sent(eventType, payload));
    }

    public List<Sent> sent() {
        return sent;
    }

    public List<String> sentTypes() {
        return sent.stream().map(Sent::eventType).toList();
    }

    public void close() {
        open = false;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
