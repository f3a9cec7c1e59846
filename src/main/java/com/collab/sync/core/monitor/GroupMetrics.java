package com.collab.sync.core.monitor;

/**
 * Per-group counters exposed to tooling.
 */
public record GroupMetrics(String topic, String group, long pending, long acked, long ackFloor) {
}
