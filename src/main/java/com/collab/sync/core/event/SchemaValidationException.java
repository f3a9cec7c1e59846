package com.collab.sync.core.event;

import com.collab.sync.core.CollabSyncException;

import java.util.List;

/**
 * Raised at publish time when event data does not match the schema of its type.
 *
 * <p>Carries every violating field, not just the first one.</p>
 */
public class SchemaValidationException extends CollabSyncException {

    private final String eventType;
    private final List<FieldViolation> violations;

    public SchemaValidationException(String eventType, List<FieldViolation> violations) {
        super("Event validation failed for " + eventType + ": " + violations);
        this.eventType = eventType;
        this.violations = List.copyOf(violations);
    }

    public String getEventType() {
        return eventType;
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
