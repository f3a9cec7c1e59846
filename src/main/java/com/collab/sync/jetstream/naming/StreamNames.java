package com.collab.sync.jetstream.naming;

import java.util.Locale;

/**
 * Naming rules between event log concepts and JetStream resources.
 *
 * <pre>
 * topic  document_events  → stream  DOCUMENT_EVENTS
 *                         → subject collab.events.document_events
 * group  doc-persistence  → durable doc-persistence
 * </pre>
 *
 * <p>JetStream names may not contain whitespace, {@code .}, {@code *} or {@code >};
 * those characters are replaced with {@code _}.</p>
 */
public final class StreamNames {

    public static final String DEFAULT_SUBJECT_PREFIX = "collab.events";

    private StreamNames() {}

    public static String stream(String topic) {
        return sanitize(topic).toUpperCase(Locale.ROOT);
    }

    public static String subject(String prefix, String topic) {
        return prefix + "." + sanitize(topic);
    }

    public static String durable(String group) {
        return sanitize(group);
    }

    /** Inverse of {@link #stream}, for listing topics. */
    public static String topic(String stream) {
        return stream.toLowerCase(Locale.ROOT);
    }

    private static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        return name.trim().replaceAll("[\\s.*>]", "_");
    }
}
