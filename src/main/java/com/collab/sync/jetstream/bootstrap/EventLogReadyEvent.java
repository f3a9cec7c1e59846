package com.collab.sync.jetstream.bootstrap;

/**
 * Published once every configured topic stream has been created or validated.
 *
 * <p>Consumer workers start on this event (or on application ready when bootstrapping is
 * disabled). Starting twice is harmless; workers are idempotent.</p>
 */
public record EventLogReadyEvent() {
}
