package com.collab.sync.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * =====================================================================
 * Event
 * =====================================================================
 *
 * PURPOSE
 * -------
 * A validated, typed, timestamped fact describing a state change. Events are
 * the unit appended to the event log and handed to consumers.
 *
 * SUBJECT
 * -------
 * {@link #subjectId} is the user id for user-scoped events and the document id
 * for document- and collaboration-scoped events. {@link #userId} is only set for
 * collaboration events (who joined, who edited).
 *
 * HEADERS
 * -------
 * Transport metadata (dead-letter provenance, requeue provenance). Headers are
 * NOT used for routing; routing is driven by {@link #eventType} only.
 *
 * IMMUTABILITY
 * ------------
 * Payload and headers are copied into unmodifiable maps on construction.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Event(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("headers") Map<String, String> headers
) {

    public Event {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Returns a copy of this event with {@code extra} merged over the existing headers.
     */
    public Event withHeaders(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.putAll(extra);
        return new Event(eventType, subjectId, userId, timestamp, payload, merged);
    }

    /**
     * Returns a copy of this event without the named headers.
     */
    public Event withoutHeaders(Iterable<String> names) {
        Map<String, String> kept = new LinkedHashMap<>(headers);
        for (String name : names) {
            kept.remove(name);
        }
        return new Event(eventType, subjectId, userId, timestamp, payload, kept);
    }

    public String header(String name) {
        return headers.get(name);
    }
}
