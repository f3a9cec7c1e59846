package com.collab.sync.core.event;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSchemaRegistryTest {

    @Test
    void builtInTypesHaveFamilies() {
        EventSchemaRegistry registry = new EventSchemaRegistry();

        assertThat(registry.familyOf("user_registered")).contains(EventFamily.USER);
        assertThat(registry.familyOf("document_deleted")).contains(EventFamily.DOCUMENT);
        assertThat(registry.familyOf("document_saved")).contains(EventFamily.COLLABORATION);
        assertThat(registry.familyOf("nope")).isEmpty();
        assertThat(registry.familyOf(null)).isEmpty();
    }

    @Test
    void extraTypesAreRegistered() {
        EventSchemaRegistry registry = new EventSchemaRegistry(Map.of("session_expired", EventFamily.COLLABORATION));

        assertThat(registry.isKnown("session_expired")).isTrue();
    }

    @Test
    void reRegisteringUnderAnotherFamilyFails() {
        EventSchemaRegistry registry = new EventSchemaRegistry();

        assertThatThrownBy(() -> registry.register("user_registered", EventFamily.DOCUMENT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void declaredEventTypeMustMatch() {
        Map<String, Object> data = Map.of(
                "event_type", "user_deleted",
                "user_id", "u",
                "timestamp", "2024-05-01T10:00:00Z",
                "payload", Map.of());

        assertThat(EventFamily.USER.validate("user_updated", data))
                .extracting(FieldViolation::field).containsExactly("event_type");
    }

    @Test
    void timestampWithoutOffsetIsReadAsUtc() {
        Map<String, Object> data = Map.of(
                "event_type", "user_updated",
                "user_id", "u",
                "timestamp", "2024-01-01T12:00:00.123456",
                "payload", Map.of());

        assertThat(EventFamily.USER.validate("user_updated", data)).isEmpty();
        assertThat(EventFamily.USER.toEvent("user_updated", data).timestamp())
                .isEqualTo(Instant.parse("2024-01-01T12:00:00.123456Z"));
    }

    @Test
    void timestampOffsetIsApplied() {
        assertThat(EventFamily.parseTimestamp("2024-01-01T14:00:00+02:00"))
                .isEqualTo(Instant.parse("2024-01-01T12:00:00Z"));
        assertThat(EventFamily.parseTimestamp("2024-01-01")).isNull();
        assertThat(EventFamily.parseTimestamp("yesterday")).isNull();
    }
}
