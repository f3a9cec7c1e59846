package com.collab.sync.core.event;

import com.collab.sync.core.model.Event;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * =====================================================================
 * EventFamily
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The three schema shapes an event can take. Every registered event type maps
 * to exactly one family (see {@link EventSchemaRegistry}).
 *
 * SCHEMAS
 * -------
 *   USER           user_id, timestamp, payload
 *   DOCUMENT       document_id, timestamp, payload
 *   COLLABORATION  document_id, user_id, timestamp, payload
 *
 * All families accept an optional {@code event_type} which, when present, must
 * equal the type being published.
 *
 * FIELD TYPES
 * -----------
 * - ids: non-blank string or integral number (normalized to string)
 * - timestamp: {@link Instant}, ISO-8601 string, or epoch milliseconds
 * - payload: JSON object ({@link Map})
 */
public enum EventFamily {

    USER("user_id", null),
    DOCUMENT("document_id", null),
    COLLABORATION("document_id", "user_id");

    public static final String EVENT_TYPE = "event_type";
    public static final String USER_ID = "user_id";
    public static final String DOCUMENT_ID = "document_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String PAYLOAD = "payload";

    /** Field that becomes {@link Event#subjectId()}. */
    private final String subjectField;

    /** Second identity field (collaboration only), becomes {@link Event#userId()}. */
    private final String actorField;

    EventFamily(String subjectField, String actorField) {
        this.subjectField = subjectField;
        this.actorField = actorField;
    }

    /**
     * Validates {@code data} against this family's schema.
     *
     * @return every violation found; empty when the data is valid
     */
    public List<FieldViolation> validate(String eventType, Map<String, Object> data) {
        List<FieldViolation> out = new ArrayList<>();
        if (data == null) {
            out.add(new FieldViolation("data", "is required"));
            return out;
        }

        Object declared = data.get(EVENT_TYPE);
        if (declared != null && !eventType.equals(declared.toString())) {
            out.add(new FieldViolation(EVENT_TYPE, "does not match published type " + eventType));
        }

        checkId(data, subjectField, out);
        if (actorField != null) {
            checkId(data, actorField, out);
        }

        Object ts = data.get(TIMESTAMP);
        if (ts == null) {
            out.add(new FieldViolation(TIMESTAMP, "is required"));
        } else if (parseTimestamp(ts) == null) {
            out.add(new FieldViolation(TIMESTAMP, "is not a valid timestamp: " + ts));
        }

        Object payload = data.get(PAYLOAD);
        if (payload == null) {
            out.add(new FieldViolation(PAYLOAD, "is required"));
        } else if (!(payload instanceof Map)) {
            out.add(new FieldViolation(PAYLOAD, "must be an object"));
        }
        return out;
    }

    /**
     * Builds the immutable {@link Event} from data that already passed {@link #validate}.
     */
    @SuppressWarnings("unchecked")
    public Event toEvent(String eventType, Map<String, Object> data) {
        String subject = normalizeId(data.get(subjectField));
        String actor = actorField == null ? null : normalizeId(data.get(actorField));
        return new Event(
                eventType,
                subject,
                actor,
                parseTimestamp(data.get(TIMESTAMP)),
                (Map<String, Object>) data.get(PAYLOAD),
                null
        );
    }

    private static void checkId(Map<String, Object> data, String field, List<FieldViolation> out) {
        Object v = data.get(field);
        if (v == null) {
            out.add(new FieldViolation(field, "is required"));
        } else if (normalizeId(v) == null) {
            out.add(new FieldViolation(field, "must be a non-blank string or an integer"));
        }
    }

    private static String normalizeId(Object v) {
        if (v instanceof String s) {
            return s.isBlank() ? null : s;
        }
        if (v instanceof Integer || v instanceof Long || v instanceof Short) {
            return v.toString();
        }
        return null;
    }

    static Instant parseTimestamp(Object v) {
        if (v instanceof Instant i) {
            return i;
        }
        if (v instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        if (v instanceof String s) {
            return parseIsoTimestamp(s);
        }
        return null;
    }

    /**
     * ISO-8601 date-time with an offset, a zone, or neither. A date-time without
     * an offset is read as UTC.
     */
    private static Instant parseIsoTimestamp(String s) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(s, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
