package com.collab.sync.core.log;

/**
 * Snapshot of a consumer group cursor.
 *
 * @param topic                 topic the group reads
 * @param group                 group name
 * @param lastDeliveredPosition highest position handed to any consumer of the group
 * @param ackFloor              every position at or below this one is acknowledged
 * @param pendingCount          entries delivered and not yet acknowledged
 * @param ackedCount            acknowledgements recorded for the group
 */
public record GroupInfo(
        String topic,
        String group,
        long lastDeliveredPosition,
        long ackFloor,
        long pendingCount,
        long ackedCount
) {
}
