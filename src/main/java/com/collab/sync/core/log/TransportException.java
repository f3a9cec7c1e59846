package com.collab.sync.core.log;

import com.collab.sync.core.CollabSyncException;

/**
 * The event log (or another remote collaborator) is unreachable or rejected a request.
 *
 * <p>Recoverable: consumers sleep and fetch again, publishers surface it to the caller.</p>
 */
public class TransportException extends CollabSyncException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
