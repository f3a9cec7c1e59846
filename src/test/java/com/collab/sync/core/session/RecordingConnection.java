package com.collab.sync.core.session;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link Connection} that keeps every frame it is sent.
 */
public class RecordingConnection implements Connection {

    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean failing;
    private volatile boolean closed;

    public RecordingConnection(String id) {
        this.id = id;
    }

    public RecordingConnection failing() {
        this.failing = true;
        return this;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) {
        if (failing) {
            throw new BroadcastDeliveryException("socket closed: " + id);
        }
        frames.add(text);
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<String> frames() {
        return frames;
    }

    public boolean isClosed() {
        return closed;
    }
}
