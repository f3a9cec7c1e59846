package com.collab.sync.core.consumer;

import com.collab.sync.core.event.Topics;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.core.log.TransportException;
import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * =====================================================================
 * EventConsumer
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Pulls entries from one consumer group of one topic and runs them through an
 * {@link EventHandler} with at-least-once semantics.
 *
 * STATE MACHINE (per entry)
 * -------------------------
 *   IDLE → FETCHING → PROCESSING ─ok──────────────▶ ACKED ─────────▶ IDLE
 *                         ▲    └─fail, attempts left ─▶ RETRYING ─┐
 *                         └──────────── backoff ──────────────────┘
 *                              └─fail, no attempts left ─▶ DEAD_LETTERED ─▶ IDLE
 *
 * The attempt count, current state and last error are held in a {@link Delivery}
 * and can be inspected through {@link #lastDelivery()}.
 *
 * DEAD LETTERING
 * --------------
 * After {@link ConsumerSettings#maxAttempts()} failed attempts the original event
 * is appended to {@link Topics#DEAD_LETTER} with provenance headers
 * ({@value #H_ORIGINAL_TOPIC}, {@value #H_ORIGINAL_POSITION}, {@value #H_GROUP},
 * {@value #H_ATTEMPTS}, {@value #H_LAST_ERROR}) and only then is the source entry
 * acknowledged. If the dead-letter append fails the source entry is left pending.
 *
 * Before each backoff pause the consumer touches the failing entry and the rest
 * of its batch ({@link EventLog#touch}), so the log does not redeliver them to
 * another worker while this one waits.
 *
 * TRANSPORT FAILURES
 * ------------------
 * A {@link TransportException} from the log never ends the loop: the consumer
 * sleeps {@link ConsumerSettings#reconnectDelay()}, re-creates its group and
 * fetches again, indefinitely.
 *
 * LIFECYCLE
 * ---------
 * {@link #start()} runs the fetch loop on a Reactor scheduler.
 * {@link #stop(Duration)} lets the in-flight batch finish its ack/backoff cycle
 * before the loop ends. {@link #pollOnce()} drives a single iteration
 * synchronously and is what tests use.
 */
public class EventConsumer {

    private static final Logger log = LoggerFactory.getLogger(EventConsumer.class);

    public static final String H_ORIGINAL_TOPIC = "dlq-original-topic";
    public static final String H_ORIGINAL_POSITION = "dlq-original-position";
    public static final String H_GROUP = "dlq-consumer-group";
    public static final String H_ATTEMPTS = "dlq-attempts";
    public static final String H_LAST_ERROR = "dlq-last-error";

    private final EventLog eventLog;
    private final String topic;
    private final String group;
    private final String consumerName;
    private final EventHandler handler;
    private final ConsumerSettings settings;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final Scheduler scheduler;

    private volatile ConsumerState state = ConsumerState.IDLE;
    private volatile boolean connected;
    private final AtomicReference<Delivery> lastDelivery = new AtomicReference<>();

    private final AtomicLong acked = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong transportErrors = new AtomicLong();

    private final AtomicBoolean running = new AtomicBoolean();
    private volatile Disposable loop;
    private volatile CountDownLatch finished = new CountDownLatch(0);

    public EventConsumer(EventLog eventLog, String topic, String group, String consumerName,
                         EventHandler handler, ConsumerSettings settings) {
        this(eventLog, topic, group, consumerName, handler, settings, Sleeper.THREAD, Schedulers.boundedElastic());
    }

    public EventConsumer(EventLog eventLog, String topic, String group, String consumerName,
                         EventHandler handler, ConsumerSettings settings, Sleeper sleeper, Scheduler scheduler) {
        this.eventLog = eventLog;
        this.topic = topic;
        this.group = group;
        this.consumerName = consumerName;
        this.handler = handler;
        this.settings = settings;
        this.backoff = settings.backoff();
        this.sleeper = sleeper;
        this.scheduler = scheduler;
    }

    /**
     * Ensures the consumer group exists.
     *
     * @return {@code false} when the log is unreachable
     */
    public boolean connect() {
        try {
            eventLog.groupCreate(topic, group, settings.startPosition());
            connected = true;
            log.info("Consumer connected topic={} group={} consumer={}", topic, group, consumerName);
        } catch (TransportException e) {
            connected = false;
            transportErrors.incrementAndGet();
            log.warn("Consumer connect failed topic={} group={}: {}", topic, group, e.toString());
        }
        return connected;
    }

    /**
     * Runs one fetch and processes every returned entry.
     *
     * @return number of entries fetched
     * @throws InterruptedException if interrupted during a backoff or reconnect pause
     */
    public int pollOnce() throws InterruptedException {
        if (!connected && !connect()) {
            sleeper.sleep(settings.reconnectDelay());
            return 0;
        }

        state = ConsumerState.FETCHING;
        List<StreamEntry> batch;
        try {
            batch = eventLog.groupRead(topic, group, consumerName, settings.batchSize(), settings.block());
        } catch (TransportException | IllegalStateException e) {
            connected = false;
            state = ConsumerState.IDLE;
            transportErrors.incrementAndGet();
            log.warn("Fetch failed topic={} group={}; reconnecting in {}: {}",
                    topic, group, settings.reconnectDelay(), e.toString());
            sleeper.sleep(settings.reconnectDelay());
            return 0;
        }

        for (int i = 0; i < batch.size(); i++) {
            process(batch.get(i), batch.subList(i + 1, batch.size()));
        }
        state = ConsumerState.IDLE;
        return batch.size();
    }

    /**
     * Drives one entry through the state machine until it is acked or dead-lettered.
     *
     * @return the terminal state for the entry; {@link ConsumerState#RETRYING} when it was left pending
     * @throws InterruptedException if interrupted during a backoff pause; the entry stays pending
     */
    public ConsumerState process(StreamEntry entry) throws InterruptedException {
        return process(entry, List.of());
    }

    private ConsumerState process(StreamEntry entry, List<StreamEntry> queued) throws InterruptedException {
        Delivery delivery = new Delivery(entry.position(), 0, ConsumerState.PROCESSING, null);

        while (true) {
            delivery = new Delivery(entry.position(), delivery.attempts() + 1, ConsumerState.PROCESSING,
                    delivery.lastError());
            transition(delivery);

            try {
                handler.handle(entry);
            } catch (Exception e) {
                delivery = new Delivery(entry.position(), delivery.attempts(), ConsumerState.PROCESSING, e.toString());
                if (delivery.attempts() >= settings.maxAttempts()) {
                    return deadLetter(entry, delivery);
                }

                Duration delay = backoff.delayFor(delivery.attempts());
                transition(delivery.next(ConsumerState.RETRYING));
                retried.incrementAndGet();
                log.warn("Handler failed topic={} group={} position={} attempt={}/{}; retrying in {}: {}",
                        topic, group, entry.position(), delivery.attempts(), settings.maxAttempts(), delay, e.toString());
                extendClaim(entry);
                queued.forEach(this::extendClaim);
                sleeper.sleep(delay);
                continue;
            }

            eventLog.ack(topic, group, entry.position());
            acked.incrementAndGet();
            transition(delivery.next(ConsumerState.ACKED));
            return ConsumerState.ACKED;
        }
    }

    private void extendClaim(StreamEntry entry) {
        try {
            if (!eventLog.touch(topic, group, entry.position())) {
                log.debug("Entry no longer pending topic={} group={} position={}", topic, group, entry.position());
            }
        } catch (RuntimeException e) {
            log.warn("Could not extend claim topic={} group={} position={}; it may be redelivered: {}",
                    topic, group, entry.position(), e.toString());
        }
    }

    private ConsumerState deadLetter(StreamEntry entry, Delivery delivery) {
        if (Topics.DEAD_LETTER.equals(topic)) {
            log.error("Handler exhausted {} attempts on the dead-letter topic itself position={}; acking: {}",
                    delivery.attempts(), entry.position(), delivery.lastError());
            eventLog.ack(topic, group, entry.position());
            transition(delivery.next(ConsumerState.DEAD_LETTERED));
            return ConsumerState.DEAD_LETTERED;
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(H_ORIGINAL_TOPIC, topic);
        headers.put(H_ORIGINAL_POSITION, Long.toString(entry.position()));
        headers.put(H_GROUP, group);
        headers.put(H_ATTEMPTS, Integer.toString(delivery.attempts()));
        headers.put(H_LAST_ERROR, String.valueOf(delivery.lastError()));
        Event copy = entry.event().withHeaders(headers);

        long dlqPosition;
        try {
            dlqPosition = eventLog.append(Topics.DEAD_LETTER, copy);
        } catch (RuntimeException e) {
            log.error("Dead-letter append failed topic={} group={} position={}; entry left pending: {}",
                    topic, group, entry.position(), e.toString());
            transition(delivery.next(ConsumerState.RETRYING));
            return ConsumerState.RETRYING;
        }

        eventLog.ack(topic, group, entry.position());
        deadLettered.incrementAndGet();
        transition(delivery.next(ConsumerState.DEAD_LETTERED));
        log.error("Dead-lettered topic={} group={} position={} after {} attempts as {}#{}: {}",
                topic, group, entry.position(), delivery.attempts(), Topics.DEAD_LETTER, dlqPosition,
                delivery.lastError());
        return ConsumerState.DEAD_LETTERED;
    }

    private void transition(Delivery delivery) {
        lastDelivery.set(delivery);
        state = delivery.state();
    }

    /**
     * Starts the background fetch loop. Idempotent.
     */
    public synchronized void start() {
        if (loop != null) {
            return;
        }
        running.set(true);
        CountDownLatch done = new CountDownLatch(1);
        finished = done;

        loop = Mono.fromCallable(this::pollSafely)
                .subscribeOn(scheduler)
                .repeat(running::get)
                .doFinally(sig -> {
                    state = ConsumerState.IDLE;
                    done.countDown();
                })
                .subscribe(
                        n -> { },
                        err -> log.error("Consumer loop terminated topic={} group={}: {}", topic, group, err.toString(), err)
                );
        log.info("Consumer started topic={} group={} consumer={}", topic, group, consumerName);
    }

    private int pollSafely() throws InterruptedException {
        try {
            return pollOnce();
        } catch (RuntimeException e) {
            transportErrors.incrementAndGet();
            log.warn("Consumer iteration failed topic={} group={}: {}", topic, group, e.toString(), e);
            connected = false;
            sleeper.sleep(settings.reconnectDelay());
            return 0;
        }
    }

    /**
     * Asks the loop to stop after the in-flight batch and waits for it.
     *
     * @return {@code true} if the loop ended within {@code timeout}; otherwise it is cancelled
     */
    public synchronized boolean stop(Duration timeout) {
        Disposable d = loop;
        if (d == null) {
            return true;
        }
        running.set(false);
        boolean clean;
        try {
            clean = finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clean = false;
        }
        if (!clean) {
            log.warn("Consumer did not finish in {} topic={} group={}; cancelling", timeout, topic, group);
            d.dispose();
        }
        loop = null;
        log.info("Consumer stopped topic={} group={} consumer={}", topic, group, consumerName);
        return clean;
    }

    public boolean isRunning() {
        return loop != null && running.get();
    }

    public ConsumerState state() {
        return state;
    }

    public Delivery lastDelivery() {
        return lastDelivery.get();
    }

    public ConsumerStats stats() {
        return new ConsumerStats(acked.get(), retried.get(), deadLettered.get(), transportErrors.get());
    }

    public String topic() {
        return topic;
    }

    public String group() {
        return group;
    }

    public String consumerName() {
        return consumerName;
    }
}
