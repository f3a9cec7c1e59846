package com.collab.sync.core.session;

/**
 * A live, connection-oriented channel to one client.
 *
 * <p>Implementations wrap a transport (a WebSocket session in production, a recorder in
 * tests). {@link #send} may be called from several threads concurrently.</p>
 */
public interface Connection {

    /** Stable identifier, unique per physical connection. */
    String id();

    /**
     * Queues a text frame for delivery.
     *
     * @throws BroadcastDeliveryException if the connection cannot accept the frame
     */
    void send(String text);

    /** Closes the connection. Safe to call more than once. */
    void close();
}
