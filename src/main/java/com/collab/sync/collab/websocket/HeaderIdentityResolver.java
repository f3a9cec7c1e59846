package com.collab.sync.collab.websocket;

import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

/**
 * Reads the user id from the {@code X-User-Id} header, then from the
 * {@code user_id} query parameter.
 */
public class HeaderIdentityResolver implements IdentityResolver {

    public static final String HEADER = "X-User-Id";
    public static final String QUERY_PARAM = "user_id";

    @Override
    public Optional<String> resolve(HandshakeInfo handshake) {
        String header = handshake.getHeaders().getFirst(HEADER);
        if (header != null && !header.isBlank()) {
            return Optional.of(header.trim());
        }
        String query = UriComponentsBuilder.fromUri(handshake.getUri()).build()
                .getQueryParams().getFirst(QUERY_PARAM);
        if (query != null && !query.isBlank()) {
            return Optional.of(query.trim());
        }
        return Optional.empty();
    }
}
