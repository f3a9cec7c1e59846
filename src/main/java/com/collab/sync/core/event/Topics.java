package com.collab.sync.core.event;

import java.util.List;

/**
 * Canonical topic names of the event log.
 *
 * <p>Keep these stable: consumer groups, JetStream streams and dashboards are keyed by them.</p>
 */
public final class Topics {

    public static final String USER = "user_events";
    public static final String DOCUMENT = "document_events";
    public static final String COLLABORATION = "collaboration_events";
    public static final String DEAD_LETTER = "dead_letter_events";
    public static final String AUDIT = "event_audit_store";

    /** Every topic, primary topics first. */
    public static final List<String> ALL = List.of(USER, DOCUMENT, COLLABORATION, DEAD_LETTER, AUDIT);

    private Topics() {}
}
