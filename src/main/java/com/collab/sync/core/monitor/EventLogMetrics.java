package com.collab.sync.core.monitor;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the event log.
 *
 * @param topicLengths    entries per topic; {@code -1} when the topic could not be read
 * @param groups          cursor counters of every known consumer group
 * @param deadLetterDepth entries on the dead-letter topic
 */
public record EventLogMetrics(Map<String, Long> topicLengths, List<GroupMetrics> groups, long deadLetterDepth) {
}
