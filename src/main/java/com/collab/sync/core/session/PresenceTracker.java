package com.collab.sync.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ephemeral cursor positions per document.
 *
 * <p>Last write wins: {@link #update} overwrites without any version check and broadcasts a
 * {@code cursor_position} message through the {@link SessionManager}. Nothing is persisted;
 * positions vanish on restart.</p>
 */
public class PresenceTracker {

    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    public static final String CURSOR_MESSAGE = "cursor_position";

    private final Map<String, Map<String, CursorPosition>> cursors = new ConcurrentHashMap<>();
    private final SessionManager sessions;
    private final Clock clock;

    public PresenceTracker(SessionManager sessions, Clock clock) {
        this.sessions = sessions;
        this.clock = clock;
    }

    /**
     * Records the user's cursor and broadcasts it to the document.
     *
     * @return number of connections the presence message reached
     */
    public int update(String documentId, String userId, Object coordinates) {
        Instant now = clock.instant();
        CursorPosition position = new CursorPosition(documentId, userId, coordinates, now);
        cursors.compute(documentId, (id, users) -> {
            Map<String, CursorPosition> next = users == null ? new LinkedHashMap<>() : users;
            next.put(userId, position);
            return next;
        });

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", CURSOR_MESSAGE);
        message.put("document_id", documentId);
        message.put("user_id", userId);
        message.put("cursor", coordinates);
        message.put("timestamp", now.toString());
        return sessions.broadcast(documentId, message);
    }

    public void remove(String documentId, String userId) {
        cursors.computeIfPresent(documentId, (id, users) -> {
            users.remove(userId);
            return users.isEmpty() ? null : users;
        });
        log.debug("Cursor removed document={} user={}", documentId, userId);
    }

    /** Current cursors of a document as {@code userId → coordinates}. */
    public Map<String, Object> snapshot(String documentId) {
        Map<String, Object> out = new LinkedHashMap<>();
        cursors.computeIfPresent(documentId, (id, users) -> {
            users.forEach((user, pos) -> out.put(user, pos.coordinates()));
            return users;
        });
        return out;
    }

    public CursorPosition get(String documentId, String userId) {
        CursorPosition[] found = new CursorPosition[1];
        cursors.computeIfPresent(documentId, (id, users) -> {
            found[0] = users.get(userId);
            return users;
        });
        return found[0];
    }
}
