package com.collab.sync.core.session;

import com.collab.sync.core.CollabSyncException;

/**
 * A client sent a frame that cannot be interpreted. The connection is closed.
 */
public class ProtocolException extends CollabSyncException {

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
