package com.collab.sync.core.event;

import com.collab.sync.core.CollabSyncException;

/**
 * Raised at publish time when an event type has no registered schema family.
 *
 * <p>Never retried: the caller must fix its input.</p>
 */
public class UnknownEventTypeException extends CollabSyncException {

    private final String eventType;

    public UnknownEventTypeException(String eventType) {
        super("Unknown event type: " + eventType);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
