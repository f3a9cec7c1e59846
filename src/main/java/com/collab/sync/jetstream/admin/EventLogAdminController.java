package com.collab.sync.jetstream.admin;

import com.collab.sync.core.deadletter.DeadLetterService;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.core.log.GroupInfo;
import com.collab.sync.core.log.PendingEntry;
import com.collab.sync.core.model.StreamEntry;
import com.collab.sync.core.monitor.EventLogMetrics;
import com.collab.sync.core.monitor.EventLogMonitor;
import com.collab.sync.core.publisher.EventPublisher;
import com.collab.sync.jetstream.config.CollabSyncProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * =====================================================================
 * EventLogAdminController
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Operator and worker-facing HTTP surface over the event log: inspect topics,
 * publish, drive a consumer group by hand (ensure / read / ack), read metrics,
 * and manage dead letters.
 *
 * ENDPOINTS (base: /admin/events)
 * -------------------------------
 *   GET  /health
 *   GET  /metrics
 *   GET  /topics/{topic}?from=1&count=50
 *   POST /publish
 *   POST /groups/ensure
 *   POST /groups/read
 *   POST /groups/ack
 *   GET  /groups/{topic}/{group}
 *   GET  /dead-letters?limit=50
 *   POST /dead-letters/{position}/requeue
 *
 * THREADING
 * ---------
 * Event log calls may block (group reads wait up to their timeout), so every
 * handler runs on {@link Schedulers#boundedElastic()}.
 *
 * ACTIVATION
 * ----------
 * Disabled by default; {@code collabsync.admin.enabled=true} turns it on.
 */
@RestController
@RequestMapping(path = "/admin/events", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "collabsync.admin", name = "enabled", havingValue = "true")
public class EventLogAdminController {

    private static final Logger log = LoggerFactory.getLogger(EventLogAdminController.class);

    static final int MAX_BATCH = 256;
    static final Duration MAX_BLOCK = Duration.ofSeconds(30);

    private final EventLog eventLog;
    private final EventPublisher publisher;
    private final EventLogMonitor monitor;
    private final DeadLetterService deadLetters;
    private final CollabSyncProperties props;

    public EventLogAdminController(EventLog eventLog, EventPublisher publisher, EventLogMonitor monitor,
                                   DeadLetterService deadLetters, CollabSyncProperties props) {
        this.eventLog = eventLog;
        this.publisher = publisher;
        this.monitor = monitor;
        this.deadLetters = deadLetters;
        this.props = props;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", props.getEventLog().getBackend(), props.getNodeId(), Instant.now().toString());
    }

    @GetMapping("/metrics")
    public Mono<EventLogMetrics> metrics() {
        return blocking(monitor::metrics);
    }

    @GetMapping("/topics/{topic}")
    public Mono<TopicResponse> topic(@PathVariable String topic,
                                     @RequestParam(defaultValue = "1") long from,
                                     @RequestParam(defaultValue = "50") int count) {
        int n = clampBatch(count);
        return blocking(() -> new TopicResponse(topic, eventLog.length(topic), eventLog.readRange(topic, from, n)));
    }

    @PostMapping(path = "/publish", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<PublishResponse>> publish(@Valid @RequestBody PublishRequest req) {
        return publisher.publishAsync(req.eventType(), req.data())
                .map(r -> {
                    log.info("Admin publish type={} topic={} position={}", req.eventType(), r.topic(), r.position());
                    return ResponseEntity.status(HttpStatus.CREATED)
                            .body(new PublishResponse(req.eventType(), r.topic(), r.position()));
                });
    }

    @PostMapping(path = "/groups/ensure", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<GroupInfo> ensureGroup(@Valid @RequestBody EnsureGroupRequest req) {
        long start = parseStart(req.start());
        return blocking(() -> {
            eventLog.groupCreate(req.topic(), req.group(), start);
            return eventLog.groupInfo(req.topic(), req.group());
        });
    }

    @PostMapping(path = "/groups/read", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ReadResponse> readGroup(@Valid @RequestBody ReadRequest req) {
        int batch = clampBatch(req.batchSize() == null ? 10 : req.batchSize());
        Duration block = clampBlock(req.timeout());
        return blocking(() -> {
            List<StreamEntry> entries = eventLog.groupRead(req.topic(), req.group(), req.consumer(), batch, block);
            return new ReadResponse(req.topic(), req.group(), req.consumer(), batch, block, entries);
        });
    }

    @PostMapping(path = "/groups/ack", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AckResponse> ack(@Valid @RequestBody AckRequest req) {
        return blocking(() -> {
            int acked = 0;
            for (Long position : req.positions()) {
                if (position != null && eventLog.ack(req.topic(), req.group(), position)) {
                    acked++;
                }
            }
            return new AckResponse(req.topic(), req.group(), req.positions().size(), acked);
        });
    }

    @GetMapping("/groups/{topic}/{group}")
    public Mono<GroupDetailResponse> group(@PathVariable String topic, @PathVariable String group) {
        return blocking(() -> new GroupDetailResponse(eventLog.groupInfo(topic, group), eventLog.pending(topic, group)));
    }

    @GetMapping("/dead-letters")
    public Mono<DeadLettersResponse> deadLetters(@RequestParam(defaultValue = "50") int limit) {
        int n = clampBatch(limit);
        return blocking(() -> new DeadLettersResponse(deadLetters.depth(), deadLetters.list(n)));
    }

    @PostMapping("/dead-letters/{position}/requeue")
    public Mono<StreamEntry> requeue(@PathVariable long position) {
        return blocking(() -> deadLetters.requeue(position));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    static long parseStart(String start) {
        if (start == null || start.isBlank()) {
            return EventLog.FROM_BEGINNING;
        }
        String s = start.trim().toLowerCase(Locale.ROOT);
        if (s.equals("beginning") || s.equals("all")) {
            return EventLog.FROM_BEGINNING;
        }
        if (s.equals("latest") || s.equals("new") || s.equals("$")) {
            return EventLog.LATEST;
        }
        try {
            long position = Long.parseLong(s);
            if (position < EventLog.LATEST) {
                throw new IllegalArgumentException("start must be >= -1 but was: " + start);
            }
            return position;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("start must be 'beginning', 'latest' or a position, got: " + start);
        }
    }

    private static int clampBatch(int n) {
        return Math.max(1, Math.min(MAX_BATCH, n));
    }

    private static Duration clampBlock(Duration d) {
        if (d == null || d.isNegative()) {
            return FlexibleDurationDeserializer.DEFAULT;
        }
        return d.compareTo(MAX_BLOCK) > 0 ? MAX_BLOCK : d;
    }

    // ---------------------------------------------------------------------
    // DTOs
    // ---------------------------------------------------------------------

    public record HealthResponse(String status, String backend, String nodeId, String timestamp) {
    }

    public record TopicResponse(String topic, long length, List<StreamEntry> entries) {
    }

    public record PublishRequest(@NotBlank String eventType, @NotNull Map<String, Object> data) {
    }

    public record PublishResponse(String eventType, String topic, long position) {
    }

    /**
     * @param start {@code beginning} (default), {@code latest}, or a position to start after
     */
    public record EnsureGroupRequest(@NotBlank String topic, @NotBlank String group, String start) {
    }

    public record ReadRequest(
            @NotBlank String topic,
            @NotBlank String group,
            @NotBlank String consumer,
            @Min(1) @Max(MAX_BATCH) Integer batchSize,
            @JsonDeserialize(using = FlexibleDurationDeserializer.class) Duration timeout
    ) {
    }

    public record ReadResponse(String topic, String group, String consumer, int requestedBatch, Duration timeout,
                               List<StreamEntry> entries) {
    }

    public record AckRequest(@NotBlank String topic, @NotBlank String group, @NotEmpty List<Long> positions) {
    }

    public record AckResponse(String topic, String group, int requested, int acked) {
    }

    public record GroupDetailResponse(GroupInfo info, List<PendingEntry> pending) {
    }

    public record DeadLettersResponse(long depth, List<StreamEntry> entries) {
    }
}
