package com.collab.sync.collab.websocket;

import com.collab.sync.collab.service.CollaborationService;
import com.collab.sync.core.session.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * =====================================================================
 * CollaborationWebSocketHandler
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Adapts one WebSocket session on {@code /ws/collaborate/{documentId}} to the
 * {@link CollaborationService} lifecycle:
 *
 *   handshake ──▶ join ──▶ handle(frame)* ──▶ leave
 *
 * The outbound side is a {@link SinkConnection}; broadcasts from any thread
 * land in its sink and are written by the session in order.
 *
 * CLOSE CODES
 * -----------
 * - no user identity on the handshake → 1008 (policy violation), before join
 * - frame that is not a JSON object   → 1007 (bad data)
 *
 * THREADING
 * ---------
 * Inbound frames are handled one at a time ({@code concatMap}) on
 * {@link Schedulers#boundedElastic()} because the first edit may block on the
 * document store load.
 */
public class CollaborationWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(CollaborationWebSocketHandler.class);

    private final CollaborationService service;
    private final IdentityResolver identity;
    private final Scheduler scheduler;

    public CollaborationWebSocketHandler(CollaborationService service, IdentityResolver identity) {
        this(service, identity, Schedulers.boundedElastic());
    }

    public CollaborationWebSocketHandler(CollaborationService service, IdentityResolver identity, Scheduler scheduler) {
        this.service = service;
        this.identity = identity;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String documentId = documentId(session.getHandshakeInfo().getUri().getPath());
        Optional<String> user = identity.resolve(session.getHandshakeInfo());
        if (documentId.isEmpty() || user.isEmpty()) {
            log.warn("Rejecting WebSocket session={} path={}: missing document or user identity",
                    session.getId(), session.getHandshakeInfo().getUri().getPath());
            return session.close(CloseStatus.POLICY_VIOLATION);
        }
        String userId = user.get();
        SinkConnection connection = new SinkConnection(session.getId());

        Mono<Void> inbound = Mono.fromRunnable(() -> service.join(documentId, userId, connection))
                .subscribeOn(scheduler)
                .thenMany(session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .concatMap(frame -> Mono.fromRunnable(
                                () -> service.handle(documentId, userId, connection, frame))
                                .subscribeOn(scheduler)))
                .onErrorResume(ProtocolException.class, e -> {
                    log.warn("Closing session={} document={} user={}: {}",
                            session.getId(), documentId, userId, e.getMessage());
                    return session.close(CloseStatus.BAD_DATA);
                })
                .doFinally(signal -> connection.close())
                .then();

        Mono<Void> outbound = session.send(connection.outbound().map(session::textMessage));

        return Mono.when(inbound, outbound)
                .doFinally(signal -> {
                    service.leave(documentId, userId, connection);
                    connection.close();
                });
    }

    static String documentId(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }
}
