package com.collab.sync.core.consumer;

import com.collab.sync.core.CollabSyncException;

/**
 * Business-logic failure inside a consumer handler.
 *
 * <p>Handlers may throw any exception; the consumer treats all of them the same way
 * (retry up to the cap, then dead-letter). This type exists for handlers that want to
 * signal a failure explicitly.</p>
 */
public class HandlerFailureException extends CollabSyncException {

    public HandlerFailureException(String message) {
        super(message);
    }

    public HandlerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
