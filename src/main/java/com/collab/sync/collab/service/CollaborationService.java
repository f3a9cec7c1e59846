package com.collab.sync.collab.service;

import com.collab.sync.core.event.EventFamily;
import com.collab.sync.core.model.Operation;
import com.collab.sync.core.publisher.EventPublisher;
import com.collab.sync.core.session.Connection;
import com.collab.sync.core.session.LiveDocument;
import com.collab.sync.core.session.PresenceTracker;
import com.collab.sync.core.session.ProtocolException;
import com.collab.sync.core.session.Session;
import com.collab.sync.core.session.SessionManager;
import com.collab.sync.core.transform.TransformEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * =====================================================================
 * CollaborationService
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The live edit path of one document channel. Transport adapters (the
 * WebSocket handler) call {@link #join}, {@link #handle} for every inbound
 * frame in arrival order, and {@link #leave} exactly when the connection ends.
 *
 * MESSAGES
 * --------
 *   inbound type       broadcast                         event published
 *   ----------------   -------------------------------   -------------------
 *   (connect)          init (joiner only), user_joined   user_joined_session
 *   document_change    document_change + revision        document_changed
 *   cursor_position    cursor_position                   -
 *   document_saved     document_saved                    document_saved
 *   (disconnect)       user_left                         user_left_session
 *
 * Every broadcast is the inbound message plus server-stamped {@code timestamp},
 * {@code user_id} and {@code document_id}. Unknown types (undo, redo, ...) are
 * ignored.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - frame is not JSON          → {@link ProtocolException}; the caller closes
 * - bad or unappliable edit    → logged, nothing sent back to the client
 * - publish fails              → logged; the broadcast already happened
 *
 * Broadcast and publish are independent; there is no transaction between them.
 *
 * SHUTDOWN
 * --------
 * {@link #shutdown()} runs the leave path for every open session before the
 * connections close, so remaining editors see {@code user_left}, the
 * {@code user_left_session} events are published and dirty buffers are saved.
 */
public class CollaborationService {

    private static final Logger log = LoggerFactory.getLogger(CollaborationService.class);

    public static final String TYPE_INIT = "init";
    public static final String TYPE_CHANGE = "document_change";
    public static final String TYPE_CURSOR = PresenceTracker.CURSOR_MESSAGE;
    public static final String TYPE_SAVED = "document_saved";
    public static final String TYPE_JOINED = "user_joined";
    public static final String TYPE_LEFT = "user_left";

    public static final String EVENT_JOINED = "user_joined_session";
    public static final String EVENT_LEFT = "user_left_session";
    public static final String EVENT_CHANGED = "document_changed";
    public static final String EVENT_SAVED = "document_saved";

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final SessionManager sessions;
    private final PresenceTracker presence;
    private final TransformEngine engine;
    private final EventPublisher publisher;
    private final LiveDocumentRegistry documents;
    private final ObjectMapper mapper;
    private final Clock clock;

    public CollaborationService(SessionManager sessions, PresenceTracker presence, TransformEngine engine,
                                EventPublisher publisher, LiveDocumentRegistry documents,
                                ObjectMapper mapper, Clock clock) {
        this.sessions = sessions;
        this.presence = presence;
        this.engine = engine;
        this.publisher = publisher;
        this.documents = documents;
        this.mapper = mapper;
        this.clock = clock;
    }

    public void join(String documentId, String userId, Connection connection) {
        sessions.connect(documentId, userId, connection);
        LiveDocument doc = documents.acquire(documentId);
        LiveDocument.Snapshot snapshot = doc.snapshot();

        Map<String, Object> init = new LinkedHashMap<>();
        init.put("type", TYPE_INIT);
        init.put("document_id", documentId);
        init.put("content", snapshot.content());
        init.put("revision", snapshot.revision());
        init.put("users", sessions.users(documentId));
        init.put("cursors", presence.snapshot(documentId));
        sessions.send(connection, init);

        Instant now = clock.instant();
        Map<String, Object> joined = new LinkedHashMap<>();
        joined.put("type", TYPE_JOINED);
        joined.put("document_id", documentId);
        joined.put("user_id", userId);
        joined.put("users", sessions.users(documentId));
        joined.put("timestamp", now.toString());
        sessions.broadcast(documentId, joined);

        publish(EVENT_JOINED, documentId, userId, now, Map.of("connection_id", connection.id())).subscribe();
    }

    /**
     * Processes one inbound frame.
     *
     * @throws ProtocolException if the frame is not a JSON object
     */
    public void handle(String documentId, String userId, Connection connection, String frame) {
        ObjectNode message = parse(frame);
        String type = message.path("type").asText("");
        Instant now = clock.instant();

        message.put("user_id", userId);
        message.put("document_id", documentId);
        message.put("timestamp", now.toString());

        switch (type) {
            case TYPE_CHANGE -> onChange(documentId, userId, message, now);
            case TYPE_CURSOR -> presence.update(documentId, userId, mapper.convertValue(message.get("cursor"), Object.class));
            case TYPE_SAVED -> onSaved(documentId, userId, message, now);
            case TYPE_JOINED, TYPE_LEFT ->
                    log.debug("Ignoring client-sent {} document={} user={}; presence is tracked by the server",
                            type, documentId, userId);
            default -> log.info("Ignoring unsupported message type='{}' document={} user={}", type, documentId, userId);
        }
    }

    /**
     * Removes the connection's session. Idempotent: only the first call broadcasts and publishes.
     */
    public void leave(String documentId, String userId, Connection connection) {
        depart(documentId, userId, connection).subscribe();
    }

    /**
     * Runs {@link #leave} for every open session, closes the connections and waits for
     * the resulting events and document saves, each up to {@code timeout}.
     */
    public void shutdown(Duration timeout) {
        List<Mono<Void>> departures = new ArrayList<>();
        int closed = 0;
        for (String documentId : sessions.activeDocuments()) {
            for (Session s : sessions.sessions(documentId)) {
                departures.add(depart(documentId, s.userId(), s.connection()));
                s.connection().close();
                closed++;
            }
        }
        try {
            Mono.when(departures).block(timeout);
        } catch (RuntimeException e) {
            log.warn("Leave events still unpublished after {}: {}", timeout, e.toString());
        }
        documents.awaitPendingSaves(timeout);
        log.info("Collaboration service shut down; closed {} sessions", closed);
    }

    public void shutdown() {
        shutdown(SHUTDOWN_TIMEOUT);
    }

    private Mono<Void> depart(String documentId, String userId, Connection connection) {
        if (sessions.disconnect(documentId, connection).isEmpty()) {
            return Mono.empty();
        }
        if (!sessions.isPresent(documentId, userId)) {
            presence.remove(documentId, userId);
        }

        Instant now = clock.instant();
        Map<String, Object> left = new LinkedHashMap<>();
        left.put("type", TYPE_LEFT);
        left.put("document_id", documentId);
        left.put("user_id", userId);
        left.put("users", sessions.users(documentId));
        left.put("timestamp", now.toString());
        sessions.broadcast(documentId, left);

        Mono<Void> published = publish(EVENT_LEFT, documentId, userId, now, Map.of("connection_id", connection.id()));
        documents.releaseIfIdle(documentId, () -> sessions.sessions(documentId).isEmpty());
        return published;
    }

    private void onChange(String documentId, String userId, ObjectNode message, Instant now) {
        Operation op;
        try {
            op = mapper.treeToValue(message.get("operation"), Operation.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping malformed operation document={} user={}: {}", documentId, userId, e.getMessage());
            return;
        }
        if (op == null) {
            log.warn("Dropping document_change without operation document={} user={}", documentId, userId);
            return;
        }

        LiveDocument.AppliedEdit applied;
        try {
            applied = documents.acquire(documentId).apply(userId, op, engine);
        } catch (RuntimeException e) {
            log.warn("Could not apply operation document={} user={} op={}: {}", documentId, userId, op, e.toString());
            return;
        }

        message.set("operation", mapper.valueToTree(applied.operation()));
        message.put("revision", applied.revision());
        sessions.broadcast(documentId, message);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", mapper.convertValue(applied.operation(), Map.class));
        payload.put("revision", applied.revision());
        publish(EVENT_CHANGED, documentId, userId, now, payload).subscribe();
    }

    private void onSaved(String documentId, String userId, ObjectNode message, Instant now) {
        LiveDocument.Snapshot snapshot = documents.acquire(documentId).snapshot();
        sessions.broadcast(documentId, message);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", snapshot.content());
        payload.put("revision", snapshot.revision());
        publish(EVENT_SAVED, documentId, userId, now, payload).subscribe();
    }

    private ObjectNode parse(String frame) {
        JsonNode node;
        try {
            node = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(node instanceof ObjectNode obj)) {
            throw new ProtocolException("Frame must be a JSON object", null);
        }
        return obj;
    }

    private Mono<Void> publish(String eventType, String documentId, String userId, Instant at, Map<String, Object> payload) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EventFamily.DOCUMENT_ID, documentId);
        data.put(EventFamily.USER_ID, userId);
        data.put(EventFamily.TIMESTAMP, at);
        data.put(EventFamily.PAYLOAD, payload);
        return publisher.publishAsync(eventType, data)
                .doOnNext(r -> log.debug("Published {} document={} position={}", eventType, documentId, r.position()))
                .doOnError(err -> log.warn("Publishing {} failed document={} user={}: {}",
                        eventType, documentId, userId, err.toString()))
                .onErrorResume(err -> Mono.empty())
                .then();
    }
}
