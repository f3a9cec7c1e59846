package com.collab.sync.core.publisher;

import com.collab.sync.core.event.EventFamily;
import com.collab.sync.core.event.EventSchemaRegistry;
import com.collab.sync.core.event.FieldViolation;
import com.collab.sync.core.event.SchemaValidationException;
import com.collab.sync.core.event.TopicRouter;
import com.collab.sync.core.event.Topics;
import com.collab.sync.core.event.UnknownEventTypeException;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * =====================================================================
 * EventPublisher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Single entry point for getting a typed event into the {@link EventLog}.
 *
 *   [ caller data map ]
 *          │  validate (type known, schema family)
 *          ▼
 *   [ Event ] ──route──▶ primary topic   (position returned)
 *          │
 *          └──────────▶ audit topic     (best effort)
 *
 * FAILURE SEMANTICS
 * -----------------
 * - unknown type          → {@link UnknownEventTypeException}, nothing appended
 * - schema violation      → {@link SchemaValidationException}, nothing appended
 * - primary append fails  → the log's exception propagates to the caller
 * - audit append fails    → logged at WARN, publish still succeeds
 *
 * Events whose type has no routing prefix go straight to the dead-letter topic.
 * They are not retried.
 *
 * THREAD SAFETY
 * -------------
 * Stateless apart from its collaborators; safe to share.
 */
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final EventLog eventLog;
    private final EventSchemaRegistry registry;
    private final TopicRouter router;
    private final Scheduler scheduler;

    public EventPublisher(EventLog eventLog, EventSchemaRegistry registry) {
        this(eventLog, registry, new TopicRouter(), Schedulers.boundedElastic());
    }

    public EventPublisher(EventLog eventLog, EventSchemaRegistry registry, TopicRouter router, Scheduler scheduler) {
        this.eventLog = eventLog;
        this.registry = registry;
        this.router = router;
        this.scheduler = scheduler;
    }

    /**
     * Validates, routes and appends one event.
     *
     * @param eventType registered event type
     * @param data      raw event fields (see {@link EventFamily})
     * @return where the event landed
     */
    public PublishResult publish(String eventType, Map<String, Object> data) {
        Event event = validate(eventType, data);
        String topic = router.route(eventType);

        long position = eventLog.append(topic, event);
        log.info("Published event type={} subject={} topic={} position={}",
                eventType, event.subjectId(), topic, position);

        try {
            eventLog.append(Topics.AUDIT, event);
        } catch (RuntimeException e) {
            log.warn("Audit append failed for type={} topic={} position={}: {}",
                    eventType, topic, position, e.toString());
        }
        return new PublishResult(topic, position, event);
    }

    /**
     * Same as {@link #publish}, off the calling thread.
     *
     * <p>Validation errors are signalled through the returned {@link Mono}.</p>
     */
    public Mono<PublishResult> publishAsync(String eventType, Map<String, Object> data) {
        return Mono.fromCallable(() -> publish(eventType, data))
                .subscribeOn(scheduler);
    }

    /**
     * Checks the type and data and builds the {@link Event} without appending anything.
     */
    public Event validate(String eventType, Map<String, Object> data) {
        EventFamily family = registry.familyOf(eventType)
                .orElseThrow(() -> new UnknownEventTypeException(eventType));

        List<FieldViolation> violations = family.validate(eventType, data);
        if (!violations.isEmpty()) {
            throw new SchemaValidationException(eventType, violations);
        }
        return family.toEvent(eventType, data);
    }
}
