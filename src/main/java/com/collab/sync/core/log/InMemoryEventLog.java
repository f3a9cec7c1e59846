package com.collab.sync.core.log;

import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * =====================================================================
 * InMemoryEventLog
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Process-local {@link EventLog}. Every topic keeps its entries in an array list
 * (index = position - 1) guarded by its own lock, so topics never contend with
 * each other.
 *
 * GROUP CURSORS
 * -------------
 * Each group tracks the highest position handed out ({@code lastDelivered}) and a
 * sorted pending set. Claiming entries advances {@code lastDelivered}; acking
 * removes from the pending set. Two consumers of the same group therefore never
 * receive the same entry.
 *
 * BLOCKING READS
 * --------------
 * {@link #groupRead} waits on the topic's {@link Condition}, signalled by
 * {@link #append}. Interrupting the waiting thread ends the wait early with an
 * empty result and the interrupt flag restored.
 *
 * DURABILITY
 * ----------
 * None. State is lost with the process. Use the JetStream back end for durable
 * deployments.
 */
public class InMemoryEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventLog.class);

    private final Map<String, TopicLog> topics = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    public InMemoryEventLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public long append(String topic, Event event) {
        Objects.requireNonNull(event, "event");
        TopicLog t = topic(topic);
        t.lock.lock();
        try {
            long position = t.entries.size() + 1L;
            t.entries.add(new StreamEntry(topic, position, event));
            t.appended.signalAll();
            return position;
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public List<StreamEntry> readRange(String topic, long fromPosition, int count) {
        TopicLog t = topics.get(topic);
        if (t == null || count <= 0) {
            return List.of();
        }
        t.lock.lock();
        try {
            int from = (int) Math.max(0, fromPosition - 1);
            int to = (int) Math.min(t.entries.size(), (long) from + count);
            if (from >= to) {
                return List.of();
            }
            return List.copyOf(t.entries.subList(from, to));
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public List<StreamEntry> readReverse(String topic, int count) {
        TopicLog t = topics.get(topic);
        if (t == null || count <= 0) {
            return List.of();
        }
        t.lock.lock();
        try {
            List<StreamEntry> out = new ArrayList<>(Math.min(count, t.entries.size()));
            for (int i = t.entries.size() - 1; i >= 0 && out.size() < count; i--) {
                out.add(t.entries.get(i));
            }
            return out;
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public long length(String topic) {
        TopicLog t = topics.get(topic);
        if (t == null) {
            return 0;
        }
        t.lock.lock();
        try {
            return t.entries.size();
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public void groupCreate(String topic, String group, long startPosition) {
        requireName(group, "group");
        TopicLog t = topic(topic);
        t.lock.lock();
        try {
            if (t.groups.containsKey(group)) {
                return;
            }
            long start;
            if (startPosition == LATEST) {
                start = t.entries.size();
            } else if (startPosition < LATEST) {
                throw new IllegalArgumentException("startPosition must be >= -1 but was: " + startPosition);
            } else {
                start = Math.min(startPosition, t.entries.size());
            }
            t.groups.put(group, new GroupCursor(start));
            log.info("Created consumer group topic={} group={} startAfter={}", topic, group, start);
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public List<StreamEntry> groupRead(String topic, String group, String consumer, int maxCount, Duration block) {
        requireName(consumer, "consumer");
        TopicLog t = topics.get(topic);
        if (t == null) {
            throw new IllegalStateException("No consumer group " + group + " on topic " + topic);
        }
        long remaining = block == null ? 0 : Math.max(0, block.toNanos());

        t.lock.lock();
        try {
            GroupCursor cursor = t.groups.get(group);
            if (cursor == null) {
                throw new IllegalStateException("No consumer group " + group + " on topic " + topic);
            }
            while (cursor.lastDelivered >= t.entries.size()) {
                if (remaining <= 0) {
                    return List.of();
                }
                try {
                    remaining = t.appended.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return List.of();
                }
            }

            int from = (int) cursor.lastDelivered;
            int to = (int) Math.min(t.entries.size(), (long) from + Math.max(1, maxCount));
            List<StreamEntry> claimed = new ArrayList<>(to - from);
            for (int i = from; i < to; i++) {
                StreamEntry entry = t.entries.get(i);
                claimed.add(entry);
                cursor.pending.put(entry.position(),
                        new PendingEntry(entry.position(), consumer, clock.instant(), 1));
            }
            cursor.lastDelivered = to;
            return claimed;
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public boolean ack(String topic, String group, long position) {
        TopicLog t = topics.get(topic);
        if (t == null) {
            return false;
        }
        t.lock.lock();
        try {
            GroupCursor cursor = t.groups.get(group);
            if (cursor == null || cursor.pending.remove(position) == null) {
                return false;
            }
            cursor.ackedCount++;
            return true;
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public boolean touch(String topic, String group, long position) {
        TopicLog t = topics.get(topic);
        if (t == null) {
            return false;
        }
        t.lock.lock();
        try {
            GroupCursor cursor = t.groups.get(group);
            return cursor != null && cursor.pending.containsKey(position);
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public List<String> topics() {
        List<String> names = new ArrayList<>(topics.keySet());
        Collections.sort(names);
        return names;
    }

    @Override
    public List<String> groups(String topic) {
        TopicLog t = topics.get(topic);
        if (t == null) {
            return List.of();
        }
        t.lock.lock();
        try {
            return List.copyOf(t.groups.keySet());
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public GroupInfo groupInfo(String topic, String group) {
        TopicLog t = topics.get(topic);
        if (t == null) {
            throw new IllegalStateException("No consumer group " + group + " on topic " + topic);
        }
        t.lock.lock();
        try {
            GroupCursor cursor = t.groups.get(group);
            if (cursor == null) {
                throw new IllegalStateException("No consumer group " + group + " on topic " + topic);
            }
            long ackFloor = cursor.pending.isEmpty() ? cursor.lastDelivered : cursor.pending.firstKey() - 1;
            return new GroupInfo(topic, group, cursor.lastDelivered, ackFloor,
                    cursor.pending.size(), cursor.ackedCount);
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public List<PendingEntry> pending(String topic, String group) {
        TopicLog t = topics.get(topic);
        if (t == null) {
            return List.of();
        }
        t.lock.lock();
        try {
            GroupCursor cursor = t.groups.get(group);
            return cursor == null ? List.of() : List.copyOf(cursor.pending.values());
        } finally {
            t.lock.unlock();
        }
    }

    private TopicLog topic(String topic) {
        requireName(topic, "topic");
        return topics.computeIfAbsent(topic, k -> new TopicLog());
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
    }

    private static final class TopicLog {
        final ReentrantLock lock = new ReentrantLock();
        final Condition appended = lock.newCondition();
        final List<StreamEntry> entries = new ArrayList<>();
        final Map<String, GroupCursor> groups = new LinkedHashMap<>();
    }

    private static final class GroupCursor {
        long lastDelivered;
        long ackedCount;
        final TreeMap<Long, PendingEntry> pending = new TreeMap<>();

        GroupCursor(long lastDelivered) {
            this.lastDelivered = lastDelivered;
        }
    }
}
