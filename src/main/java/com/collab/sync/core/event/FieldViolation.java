package com.collab.sync.core.event;

/**
 * One field of an event's data that failed schema validation.
 */
public record FieldViolation(String field, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
