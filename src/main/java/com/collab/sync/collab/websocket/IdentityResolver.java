package com.collab.sync.collab.websocket;

import org.springframework.web.reactive.socket.HandshakeInfo;

import java.util.Optional;

/**
 * Extracts the authenticated user id from a WebSocket handshake.
 *
 * <p>Authentication itself happens upstream; this only reads the identity the
 * gateway attached.</p>
 */
public interface IdentityResolver {

    Optional<String> resolve(HandshakeInfo handshake);
}
