package com.collab.sync.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PresenceTrackerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private SessionManager sessions;
    private PresenceTracker presence;
    private RecordingConnection watcher;

    @BeforeEach
    void setUp() {
        sessions = new SessionManager(mapper, clock);
        presence = new PresenceTracker(sessions, clock);
        watcher = new RecordingConnection("w");
        sessions.connect("doc", "bob", watcher);
    }

    @Test
    void updateStoresAndBroadcastsCursor() throws Exception {
        int reached = presence.update("doc", "alice", Map.of("line", 3, "column", 7));

        assertThat(reached).isEqualTo(1);
        JsonNode sent = mapper.readTree(watcher.frames().get(0));
        assertThat(sent.get("type").asText()).isEqualTo("cursor_position");
        assertThat(sent.get("user_id").asText()).isEqualTo("alice");
        assertThat(sent.get("cursor").get("line").asInt()).isEqualTo(3);
        assertThat(sent.get("timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");

        CursorPosition stored = presence.get("doc", "alice");
        assertThat(stored.coordinates()).isEqualTo(Map.of("line", 3, "column", 7));
        assertThat(stored.updatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void latestUpdateWins() {
        presence.update("doc", "alice", 1);
        presence.update("doc", "alice", 9);

        assertThat(presence.snapshot("doc")).containsExactly(Map.entry("alice", 9));
    }

    @Test
    void removeForgetsTheUser() {
        presence.update("doc", "alice", 1);
        presence.update("doc", "carol", 2);

        presence.remove("doc", "alice");

        assertThat(presence.get("doc", "alice")).isNull();
        assertThat(presence.snapshot("doc")).containsOnlyKeys("carol");
    }

    @Test
    void unknownDocumentHasNoCursors() {
        assertThat(presence.snapshot("nope")).isEmpty();
    }
}
