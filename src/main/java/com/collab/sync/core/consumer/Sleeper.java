package com.collab.sync.core.consumer;

import java.time.Duration;

/**
 * Blocking pause used between retries and reconnect attempts. Tests substitute a recorder.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
