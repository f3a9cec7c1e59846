package com.collab.sync.core.consumer;

import java.time.Duration;

/**
 * Delay before re-running a failed handler.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attempt the attempt that just failed, starting at 1
     */
    Duration delayFor(int attempt);
}
