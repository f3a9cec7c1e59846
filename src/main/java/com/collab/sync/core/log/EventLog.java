package com.collab.sync.core.log;

import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;

import java.time.Duration;
import java.util.List;

/**
 * =====================================================================
 * EventLog
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Ordered, append-only, per-topic event storage with consumer-group semantics.
 * This is the transport-facing contract of the event backbone. Two
 * implementations exist:
 *
 *   - {@link InMemoryEventLog}: in-process, used locally and in tests
 *   - {@code JetStreamEventLog}: NATS JetStream, durable
 *
 * ORDERING
 * --------
 * Each topic is totally ordered. {@link #append} assigns a strictly increasing
 * position (starting at 1). Entries are never edited; consumer groups only mark
 * them acknowledged.
 *
 * CONSUMER GROUPS
 * ---------------
 * A group is a named cursor over one topic. Several consumers may read through
 * the same group; each entry is handed to exactly one of them and stays
 * "pending" for the group until acknowledged.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - back end unreachable            → {@link TransportException}
 * - read from a group never created → {@link IllegalStateException}
 *
 * THREAD SAFETY
 * -------------
 * Implementations MUST be safe for concurrent use.
 */
public interface EventLog {

    /** Start position for {@link #groupCreate}: deliver every entry of the topic. */
    long FROM_BEGINNING = 0L;

    /** Start position for {@link #groupCreate}: deliver only entries appended after creation. */
    long LATEST = -1L;

    /**
     * Appends an event and returns the position it was assigned.
     */
    long append(String topic, Event event);

    /**
     * Reads up to {@code count} entries with position {@code >= fromPosition}, oldest first.
     */
    List<StreamEntry> readRange(String topic, long fromPosition, int count);

    /**
     * Reads up to {@code count} of the most recent entries, newest first.
     */
    List<StreamEntry> readReverse(String topic, int count);

    /**
     * Number of entries currently stored in the topic.
     */
    long length(String topic);

    /**
     * Creates a consumer group positioned after {@code startPosition}
     * ({@link #FROM_BEGINNING}, {@link #LATEST}, or a concrete position).
     *
     * <p>Idempotent: creating an existing group is a no-op and does not move its cursor.
     * The topic is created if it does not exist.</p>
     */
    void groupCreate(String topic, String group, long startPosition);

    /**
     * Claims up to {@code maxCount} entries that no consumer of the group has been handed yet.
     *
     * <p>Blocks up to {@code block} when nothing is available. Returned entries are pending
     * for the group until {@link #ack} is called.</p>
     *
     * @return claimed entries in log order; empty when the wait elapsed
     */
    List<StreamEntry> groupRead(String topic, String group, String consumer, int maxCount, Duration block);

    /**
     * Marks an entry complete for a group.
     *
     * @return {@code true} if the entry was pending for the group
     */
    boolean ack(String topic, String group, long position);

    /**
     * Tells the log a pending entry is still being worked on, so it is not redelivered
     * while its consumer backs off between attempts.
     *
     * @return {@code true} if the entry is still pending for the group
     */
    boolean touch(String topic, String group, long position);

    /**
     * Names of the topics known to this log.
     */
    List<String> topics();

    /**
     * Names of the consumer groups registered on a topic.
     */
    List<String> groups(String topic);

    /**
     * Cursor state of a consumer group.
     */
    GroupInfo groupInfo(String topic, String group);

    /**
     * Entries handed out to consumers of the group and not yet acknowledged.
     */
    List<PendingEntry> pending(String topic, String group);
}
