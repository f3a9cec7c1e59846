package com.collab.sync.core.consumer;

import java.time.Duration;

/**
 * Deterministic exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}.</p>
 */
public final class ExponentialBackoff implements BackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoff(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must be >= 0, got base=" + baseDelay + " max=" + maxDelay);
        }
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
    }

    @Override
    public Duration delayFor(int attempt) {
        if (attempt <= 0 || baseDelayMs == 0) {
            return Duration.ZERO;
        }
        long delay;
        if (attempt >= 31) {
            delay = maxDelayMs;
        } else {
            long shift = 1L << (attempt - 1);
            // overflow guard
            delay = shift > maxDelayMs / baseDelayMs ? maxDelayMs : baseDelayMs * shift;
        }
        return Duration.ofMillis(Math.min(maxDelayMs, delay));
    }
}
