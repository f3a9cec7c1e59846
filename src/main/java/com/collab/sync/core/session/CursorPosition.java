package com.collab.sync.core.session;

import java.time.Instant;

/**
 * Last reported cursor of one user in one document. Coordinates are client-defined JSON.
 */
public record CursorPosition(String documentId, String userId, Object coordinates, Instant updatedAt) {
}
