package com.collab.sync.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SessionManagerTest {

    private SessionManager manager;
    private RecordingConnection a;
    private RecordingConnection b;
    private RecordingConnection c;

    @BeforeEach
    void setUp() {
        manager = new SessionManager(new ObjectMapper().registerModule(new JavaTimeModule()),
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        a = new RecordingConnection("a");
        b = new RecordingConnection("b");
        c = new RecordingConnection("c");
        manager.connect("doc", "alice", a);
        manager.connect("doc", "bob", b);
        manager.connect("doc", "carol", c);
    }

    @Test
    void disconnectingOneOfThreeLeavesTheOtherTwo() {
        assertThat(manager.disconnect("doc", b)).map(Session::userId).contains("bob");

        assertThat(manager.sessions("doc")).extracting(Session::userId).containsExactly("alice", "carol");
        assertThat(manager.broadcast("doc", "{\"type\":\"ping\"}")).isEqualTo(2);
        assertThat(b.frames()).isEmpty();
    }

    @Test
    void secondDisconnectIsANoOp() {
        manager.disconnect("doc", a);

        assertThat(manager.disconnect("doc", a)).isEmpty();
        assertThat(manager.sessionCount()).isEqualTo(2);
    }

    @Test
    void lastDisconnectRemovesTheDocument() {
        manager.disconnect("doc", a);
        manager.disconnect("doc", b);
        manager.disconnect("doc", c);

        assertThat(manager.activeDocuments()).isEmpty();
        assertThat(manager.broadcast("doc", Map.of("type", "x"))).isZero();
    }

    @Test
    void connectIsIdempotentPerConnection() {
        Session first = manager.sessions("doc").get(0);

        Session again = manager.connect("doc", "alice", a);

        assertThat(again).isSameAs(first);
        assertThat(manager.sessions("doc")).hasSize(3);
    }

    @Test
    void failingConnectionDoesNotStopBroadcast() {
        RecordingConnection broken = new RecordingConnection("broken").failing();
        manager.connect("doc", "dave", broken);

        int delivered = manager.broadcast("doc", Map.of("type", "document_change"));

        assertThat(delivered).isEqualTo(3);
        assertThat(a.frames()).containsExactly("{\"type\":\"document_change\"}");
        assertThat(c.frames()).hasSize(1);
    }

    @Test
    void documentsAreIsolated() {
        RecordingConnection other = new RecordingConnection("other");
        manager.connect("doc-2", "erin", other);

        manager.broadcast("doc-2", "hello");

        assertThat(other.frames()).containsExactly("hello");
        assertThat(a.frames()).isEmpty();
    }

    @Test
    void usersAreDistinctAcrossConnections() {
        manager.connect("doc", "alice", new RecordingConnection("a2"));

        assertThat(manager.users("doc")).containsExactly("alice", "bob", "carol");
        manager.disconnect("doc", a);
        assertThat(manager.isPresent("doc", "alice")).isTrue();
    }

    @Test
    void shutdownClosesEveryConnection() {
        manager.shutdown();

        assertThat(a.isClosed()).isTrue();
        assertThat(b.isClosed()).isTrue();
        assertThat(manager.sessionCount()).isZero();
    }

    @Test
    void unserializableMessageIsDroppedWithoutRaising() {
        Object unserializable = new Object();

        assertThat(manager.broadcast("doc", unserializable)).isZero();
        assertThat(manager.send(a, unserializable)).isFalse();
        assertThat(a.frames()).isEmpty();
    }

    @Test
    void shutdownClosesConnectionsWhileStillRegistered() {
        List<Integer> seenAtClose = new ArrayList<>();
        manager.connect("doc", "dave", new Connection() {
            @Override
            public String id() {
                return "d";
            }

            @Override
            public void send(String text) {
            }

            @Override
            public void close() {
                seenAtClose.add(manager.sessions("doc").size());
            }
        });

        manager.shutdown();

        assertThat(seenAtClose).containsExactly(4);
        assertThat(manager.sessionCount()).isZero();
    }
}
