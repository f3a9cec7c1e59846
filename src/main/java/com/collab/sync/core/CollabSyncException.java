package com.collab.sync.core;

/**
 * Root of the unchecked exceptions raised by the synchronization core.
 */
public class CollabSyncException extends RuntimeException {

    public CollabSyncException(String message) {
        super(message);
    }

    public CollabSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
