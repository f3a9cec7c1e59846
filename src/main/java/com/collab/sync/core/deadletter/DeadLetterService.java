package com.collab.sync.core.deadletter;

import com.collab.sync.core.consumer.EventConsumer;
import com.collab.sync.core.event.Topics;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Map;

/**
 * Manual reprocessing path for dead-lettered events.
 *
 * <p>Dead-letter entries are never removed. Requeueing appends a fresh copy of the original
 * event (without the {@code dlq-*} headers) to the topic it came from, tagged with
 * {@value #H_REQUEUED_FROM}. Consumer groups on that topic then see it as a new entry.</p>
 */
public class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    public static final String H_REQUEUED_FROM = "requeued-from-position";

    private static final List<String> DLQ_HEADERS = List.of(
            EventConsumer.H_ORIGINAL_TOPIC,
            EventConsumer.H_ORIGINAL_POSITION,
            EventConsumer.H_GROUP,
            EventConsumer.H_ATTEMPTS,
            EventConsumer.H_LAST_ERROR
    );

    private final EventLog eventLog;

    public DeadLetterService(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    /** Most recent dead-letter entries, newest first. */
    public List<StreamEntry> list(int limit) {
        return eventLog.readReverse(Topics.DEAD_LETTER, limit);
    }

    public long depth() {
        return eventLog.length(Topics.DEAD_LETTER);
    }

    /**
     * Re-appends a dead-letter entry to its original topic.
     *
     * @throws NoSuchElementException   if no entry exists at {@code position}
     * @throws IllegalArgumentException if the entry was routed to the dead-letter topic directly
     *                                  and has no original topic
     */
    public StreamEntry requeue(long position) {
        List<StreamEntry> found = eventLog.readRange(Topics.DEAD_LETTER, position, 1);
        if (found.isEmpty() || found.get(0).position() != position) {
            throw new NoSuchElementException("No dead-letter entry at position " + position);
        }
        StreamEntry dead = found.get(0);
        String target = dead.event().header(EventConsumer.H_ORIGINAL_TOPIC);
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException(
                    "Dead-letter entry " + position + " has no original topic (type "
                            + dead.event().eventType() + " has no route)");
        }

        Event copy = dead.event()
                .withoutHeaders(DLQ_HEADERS)
                .withHeaders(Map.of(H_REQUEUED_FROM, Long.toString(position)));
        long newPosition = eventLog.append(target, copy);
        log.info("Requeued dead-letter position={} type={} to topic={} position={}",
                position, copy.eventType(), target, newPosition);
        return new StreamEntry(target, newPosition, copy);
    }
}
