package com.collab.sync.core.session;

import java.time.Instant;

/**
 * A live connection bound to a document and the user behind it.
 */
public record Session(String documentId, String userId, Connection connection, Instant joinedAt) {
}
