package com.collab.sync.core.log;

import java.time.Instant;

/**
 * An entry handed to a consumer and not yet acknowledged.
 */
public record PendingEntry(long position, String consumer, Instant deliveredAt, int deliveryCount) {
}
