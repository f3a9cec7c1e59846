package com.collab.sync.collab.websocket;

import com.collab.sync.core.session.BroadcastDeliveryException;
import com.collab.sync.core.session.Connection;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * {@link Connection} backed by a unicast sink that feeds a WebSocket session's
 * outbound stream.
 *
 * <p>Sends from different broadcasters are serialized; a sink accepts only one
 * emitter at a time.</p>
 */
public class SinkConnection implements Connection {

    private final String id;
    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();

    public SinkConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized void send(String text) {
        Sinks.EmitResult result = sink.tryEmitNext(text);
        if (result.isFailure()) {
            throw new BroadcastDeliveryException("Connection " + id + " rejected message: " + result);
        }
    }

    @Override
    public synchronized void close() {
        sink.tryEmitComplete();
    }

    public Flux<String> outbound() {
        return sink.asFlux();
    }
}
