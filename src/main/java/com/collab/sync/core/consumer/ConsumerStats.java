package com.collab.sync.core.consumer;

/**
 * Counters of a single {@link EventConsumer} since it was created.
 */
public record ConsumerStats(long acked, long retried, long deadLettered, long transportErrors) {
}
