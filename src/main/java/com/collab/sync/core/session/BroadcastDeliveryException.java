package com.collab.sync.core.session;

import com.collab.sync.core.CollabSyncException;

/**
 * A single connection could not accept a message (closed socket, full buffer).
 *
 * <p>Raised by {@link Connection#send(String)} and swallowed by the broadcast loop.</p>
 */
public class BroadcastDeliveryException extends CollabSyncException {

    public BroadcastDeliveryException(String message) {
        super(message);
    }

    public BroadcastDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
