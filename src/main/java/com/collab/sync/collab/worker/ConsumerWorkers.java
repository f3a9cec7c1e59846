package com.collab.sync.collab.worker;

import com.collab.sync.core.consumer.ConsumerSettings;
import com.collab.sync.core.consumer.ConsumerStats;
import com.collab.sync.core.consumer.EventConsumer;
import com.collab.sync.core.consumer.EventHandler;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.jetstream.bootstrap.EventLogReadyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one {@link EventConsumer} per configured topic for the lifetime of the
 * application.
 *
 * <h2>Operational behavior</h2>
 * <ul>
 *   <li>Starts after the application is ready, or when the event log reports its
 *       topics provisioned. Whichever comes first wins; starting is idempotent.</li>
 *   <li>Never fails the Spring context when the log is unreachable; each consumer
 *       reconnects on its own.</li>
 *   <li>Stops every consumer on shutdown, waiting up to the configured timeout.</li>
 * </ul>
 */
public class ConsumerWorkers implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ConsumerWorkers.class);

    private final EventLog eventLog;
    private final EventHandler handler;
    private final ConsumerWorkerProperties props;
    private final String consumerName;

    private final AtomicReference<List<EventConsumer>> running = new AtomicReference<>();

    public ConsumerWorkers(EventLog eventLog, EventHandler handler, ConsumerWorkerProperties props, String nodeId) {
        this.eventLog = eventLog;
        this.handler = handler;
        this.props = props;
        String configured = props.getConsumerName();
        this.consumerName = configured == null || configured.isBlank() ? nodeId : configured;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfNotStarted();
    }

    @EventListener(EventLogReadyEvent.class)
    public void onEventLogReady() {
        startIfNotStarted();
    }

    void startIfNotStarted() {
        List<EventConsumer> consumers = new ArrayList<>();
        if (!running.compareAndSet(null, consumers)) {
            return;
        }
        ConsumerSettings settings = props.toSettings();
        for (String topic : props.getTopics()) {
            EventConsumer consumer = new EventConsumer(eventLog, topic, props.getGroup(), consumerName, handler, settings);
            consumer.start();
            consumers.add(consumer);
        }
    }

    public List<EventConsumer> consumers() {
        List<EventConsumer> current = running.get();
        return current == null ? List.of() : List.copyOf(current);
    }

    @Override
    public void destroy() {
        List<EventConsumer> consumers = running.getAndSet(null);
        if (consumers == null) {
            return;
        }
        for (EventConsumer consumer : consumers) {
            boolean clean = consumer.stop(props.getStopTimeout());
            ConsumerStats stats = consumer.stats();
            log.info("Stopped consumer topic={} group={} clean={} stats={}",
                    consumer.topic(), consumer.group(), clean, stats);
        }
    }
}
