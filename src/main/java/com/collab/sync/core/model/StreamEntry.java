package com.collab.sync.core.model;

/**
 * An {@link Event} plus the position the event log assigned to it when it was appended.
 *
 * <p>Positions are strictly increasing per topic and start at 1. Entries are never edited;
 * consumer groups only mark them acknowledged.</p>
 */
public record StreamEntry(String topic, long position, Event event) {
}
