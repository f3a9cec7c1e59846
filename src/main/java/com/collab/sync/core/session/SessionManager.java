package com.collab.sync.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * =====================================================================
 * SessionManager
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Owns the set of live {@link Session}s per document and fans messages out to
 * them.
 *
 * SHARED STATE
 * ------------
 *   documentId → (connectionId → Session)
 *
 * Every register/remove runs inside {@link ConcurrentHashMap#compute} for the
 * document key, so mutations of one document are serialized while different
 * documents never block each other. When the last session of a document is
 * removed, the document's entry disappears.
 *
 * BROADCAST
 * ---------
 * Best effort per connection. The message is serialized once, then sent to a
 * snapshot of the document's sessions. A failing connection is logged at WARN
 * and skipped; the caller never sees the failure.
 *
 * LIFECYCLE
 * ---------
 * One instance per process, created by Spring. {@link #shutdown()} closes every
 * connection and clears all state.
 */
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, Map<String, Session>> documents = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;
    private final Clock clock;

    public SessionManager(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Registers {@code connection} for {@code documentId}.
     *
     * <p>Connecting the same connection twice returns the session created the first time.</p>
     */
    public Session connect(String documentId, String userId, Connection connection) {
        AtomicReference<Session> result = new AtomicReference<>();
        documents.compute(documentId, (id, sessions) -> {
            Map<String, Session> next = sessions == null ? new LinkedHashMap<>() : sessions;
            Session existing = next.get(connection.id());
            if (existing != null) {
                result.set(existing);
            } else {
                Session created = new Session(id, userId, connection, clock.instant());
                next.put(connection.id(), created);
                result.set(created);
            }
            return next;
        });
        log.info("Session connected document={} user={} connection={}", documentId, userId, connection.id());
        return result.get();
    }

    /**
     * Removes the session of {@code connection}. Idempotent.
     *
     * @return the removed session, empty if it was not registered
     */
    public Optional<Session> disconnect(String documentId, Connection connection) {
        AtomicReference<Session> removed = new AtomicReference<>();
        documents.computeIfPresent(documentId, (id, sessions) -> {
            removed.set(sessions.remove(connection.id()));
            return sessions.isEmpty() ? null : sessions;
        });
        if (removed.get() != null) {
            log.info("Session disconnected document={} user={} connection={}",
                    documentId, removed.get().userId(), connection.id());
        }
        return Optional.ofNullable(removed.get());
    }

    /**
     * Sends {@code message} to every session of the document.
     *
     * @param message a pre-rendered JSON string, or any object Jackson can serialize
     * @return number of connections that accepted the message
     */
    public int broadcast(String documentId, Object message) {
        List<Session> targets = sessions(documentId);
        if (targets.isEmpty()) {
            return 0;
        }
        String text;
        try {
            text = render(message);
        } catch (IllegalArgumentException e) {
            log.error("Dropping broadcast to document={}: {}", documentId, e.getMessage());
            return 0;
        }
        AtomicInteger delivered = new AtomicInteger();
        for (Session s : targets) {
            if (deliver(s.connection(), text)) {
                delivered.incrementAndGet();
            }
        }
        return delivered.get();
    }

    /**
     * Sends {@code message} to a single connection.
     *
     * @return {@code false} if the connection rejected it
     */
    public boolean send(Connection connection, Object message) {
        try {
            return deliver(connection, render(message));
        } catch (IllegalArgumentException e) {
            log.error("Dropping message to connection={}: {}", connection.id(), e.getMessage());
            return false;
        }
    }

    private boolean deliver(Connection connection, String text) {
        try {
            connection.send(text);
            return true;
        } catch (BroadcastDeliveryException e) {
            log.warn("Delivery failed connection={}: {}", connection.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Delivery failed connection={}: {}", connection.id(), e.toString());
        }
        return false;
    }

    /** Snapshot of the sessions of a document, in join order. */
    public List<Session> sessions(String documentId) {
        List<Session> out = new ArrayList<>();
        documents.computeIfPresent(documentId, (id, sessions) -> {
            out.addAll(sessions.values());
            return sessions;
        });
        return out;
    }

    /** Distinct users currently connected to a document, in join order. */
    public Set<String> users(String documentId) {
        Set<String> users = new LinkedHashSet<>();
        for (Session s : sessions(documentId)) {
            users.add(s.userId());
        }
        return users;
    }

    /** Whether {@code userId} still has at least one connection on the document. */
    public boolean isPresent(String documentId, String userId) {
        return users(documentId).contains(userId);
    }

    public Set<String> activeDocuments() {
        return Set.copyOf(documents.keySet());
    }

    public int sessionCount() {
        int n = 0;
        for (String documentId : activeDocuments()) {
            n += sessions(documentId).size();
        }
        return n;
    }

    /**
     * Closes every registered connection, then forgets all sessions. Connections are
     * still registered while they close.
     */
    public void shutdown() {
        int closed = 0;
        for (String documentId : activeDocuments()) {
            for (Session s : sessions(documentId)) {
                try {
                    s.connection().close();
                    closed++;
                } catch (RuntimeException e) {
                    log.warn("Close failed connection={}: {}", s.connection().id(), e.toString());
                }
            }
        }
        documents.clear();
        log.info("Session manager shut down; closed {} connections", closed);
    }

    private String render(Object message) {
        if (message instanceof String s) {
            return s;
        }
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
