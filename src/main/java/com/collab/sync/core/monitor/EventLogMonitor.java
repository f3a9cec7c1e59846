package com.collab.sync.core.monitor;

import com.collab.sync.core.event.Topics;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.core.log.GroupInfo;
import com.collab.sync.core.log.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * =====================================================================
 * EventLogMonitor
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Reads topic lengths, group cursors and dead-letter depth from the
 * {@link EventLog} for the admin API, Micrometer gauges, and the periodic
 * dead-letter alert.
 *
 * FAILURE SEMANTICS
 * -----------------
 * A topic or group that cannot be read is reported as {@code -1} / skipped and
 * logged at WARN; metrics collection never throws.
 */
public class EventLogMonitor {

    private static final Logger log = LoggerFactory.getLogger(EventLogMonitor.class);

    private final EventLog eventLog;
    private volatile Disposable periodic;

    public EventLogMonitor(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    public EventLogMetrics metrics() {
        Map<String, Long> lengths = new LinkedHashMap<>();
        List<GroupMetrics> groups = new ArrayList<>();

        for (String topic : knownTopics()) {
            lengths.put(topic, topicLength(topic));
            for (String group : safeGroups(topic)) {
                try {
                    GroupInfo info = eventLog.groupInfo(topic, group);
                    groups.add(new GroupMetrics(topic, group, info.pendingCount(), info.ackedCount(), info.ackFloor()));
                } catch (TransportException | IllegalStateException e) {
                    log.warn("Could not read group topic={} group={}: {}", topic, group, e.toString());
                }
            }
        }
        long dlq = lengths.getOrDefault(Topics.DEAD_LETTER, 0L);
        return new EventLogMetrics(lengths, groups, Math.max(0, dlq));
    }

    public long topicLength(String topic) {
        try {
            return eventLog.length(topic);
        } catch (TransportException e) {
            log.warn("Could not read length of topic={}: {}", topic, e.toString());
            return -1;
        }
    }

    public long deadLetterDepth() {
        return Math.max(0, topicLength(Topics.DEAD_LETTER));
    }

    /**
     * Logs at ERROR when the dead-letter topic holds at least {@code threshold} entries.
     *
     * @return {@code true} if the threshold was reached
     */
    public boolean checkDeadLetter(long threshold) {
        long depth = deadLetterDepth();
        if (depth >= threshold) {
            log.error("Dead-letter topic {} holds {} events (threshold {}); immediate attention required",
                    Topics.DEAD_LETTER, depth, threshold);
            return true;
        }
        return false;
    }

    /**
     * Starts a periodic {@link #checkDeadLetter} on a Reactor interval. Idempotent.
     */
    public synchronized void startPeriodicCheck(Duration interval, long threshold) {
        if (periodic != null) {
            return;
        }
        periodic = Flux.interval(interval, interval)
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(tick -> checkDeadLetter(threshold))
                .onErrorContinue((err, tick) -> log.warn("Dead-letter check failed: {}", err.toString()))
                .subscribe();
        log.info("Dead-letter check scheduled every {} threshold={}", interval, threshold);
    }

    public synchronized void stop() {
        if (periodic != null) {
            periodic.dispose();
            periodic = null;
        }
    }

    private Set<String> knownTopics() {
        Set<String> topics = new LinkedHashSet<>(Topics.ALL);
        try {
            topics.addAll(eventLog.topics());
        } catch (TransportException e) {
            log.warn("Could not list topics: {}", e.toString());
        }
        return topics;
    }

    private List<String> safeGroups(String topic) {
        try {
            return eventLog.groups(topic);
        } catch (TransportException e) {
            log.warn("Could not list groups of topic={}: {}", topic, e.toString());
            return List.of();
        }
    }
}
