package com.collab.sync.core.consumer;

import com.collab.sync.core.log.EventLog;

import java.time.Duration;

/**
 * Tuning knobs of an {@link EventConsumer}.
 *
 * @param batchSize      max entries claimed per fetch
 * @param block          how long a fetch waits for new entries
 * @param maxAttempts    handler invocations per entry before it is dead-lettered
 * @param baseDelay      backoff after the first failed attempt
 * @param maxDelay       backoff cap
 * @param reconnectDelay pause after a transport failure
 * @param startPosition  where a newly created group starts ({@link EventLog#FROM_BEGINNING} or {@link EventLog#LATEST})
 */
public record ConsumerSettings(
        int batchSize,
        Duration block,
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        Duration reconnectDelay,
        long startPosition
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    public ConsumerSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0 but was: " + batchSize);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0 but was: " + maxAttempts);
        }
    }

    public static ConsumerSettings defaults() {
        return new ConsumerSettings(
                10,
                Duration.ofSeconds(5),
                DEFAULT_MAX_ATTEMPTS,
                Duration.ofSeconds(2),
                Duration.ofSeconds(60),
                Duration.ofSeconds(2),
                EventLog.FROM_BEGINNING
        );
    }

    public BackoffPolicy backoff() {
        return new ExponentialBackoff(baseDelay, maxDelay);
    }
}
