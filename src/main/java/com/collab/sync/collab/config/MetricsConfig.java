package com.collab.sync.collab.config;

import com.collab.sync.core.event.Topics;
import com.collab.sync.core.monitor.EventLogMonitor;
import com.collab.sync.core.monitor.GroupMetrics;
import com.collab.sync.core.session.SessionManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Micrometer gauges over the event log and live sessions, exported through the actuator.
 *
 * <pre>
 *   collabsync.topic.entries{topic}          entries per well-known topic
 *   collabsync.deadletter.depth              entries on the dead-letter topic
 *   collabsync.group.pending{topic,group}    claimed but unacknowledged entries
 *   collabsync.sessions.active               open collaboration connections
 * </pre>
 */
@Configuration
public class MetricsConfig {

    @Bean
    public EventLogMeterBinder eventLogMeterBinder(EventLogMonitor monitor, SessionManager sessions,
                                                   MonitorProperties props) {
        return new EventLogMeterBinder(monitor, sessions, props.getMetricsRefresh());
    }

    public static class EventLogMeterBinder implements MeterBinder, DisposableBean {

        private static final Logger log = LoggerFactory.getLogger(EventLogMeterBinder.class);

        private final EventLogMonitor monitor;
        private final SessionManager sessions;
        private final Duration refresh;
        private volatile Disposable refresher;

        EventLogMeterBinder(EventLogMonitor monitor, SessionManager sessions, Duration refresh) {
            this.monitor = monitor;
            this.sessions = sessions;
            this.refresh = refresh;
        }

        @Override
        public void bindTo(MeterRegistry registry) {
            for (String topic : Topics.ALL) {
                Gauge.builder("collabsync.topic.entries", monitor, m -> m.topicLength(topic))
                        .tag("topic", topic)
                        .description("Entries appended to the topic")
                        .register(registry);
            }
            Gauge.builder("collabsync.deadletter.depth", monitor, EventLogMonitor::deadLetterDepth)
                    .description("Entries on the dead-letter topic")
                    .register(registry);
            Gauge.builder("collabsync.sessions.active", sessions, SessionManager::sessionCount)
                    .description("Open collaboration connections")
                    .register(registry);

            MultiGauge pending = MultiGauge.builder("collabsync.group.pending")
                    .description("Delivered but unacknowledged entries per consumer group")
                    .register(registry);
            refresher = Flux.interval(Duration.ZERO, refresh)
                    .publishOn(Schedulers.boundedElastic())
                    .subscribe(
                            tick -> refreshPending(pending),
                            err -> log.warn("Group gauge refresh stopped: {}", err.toString())
                    );
        }

        private void refreshPending(MultiGauge pending) {
            List<GroupMetrics> groups = monitor.metrics().groups();
            List<MultiGauge.Row<?>> rows = groups.stream()
                    .<MultiGauge.Row<?>>map(g -> MultiGauge.Row.of(Tags.of("topic", g.topic(), "group", g.group()), g.pending()))
                    .toList();
            pending.register(rows, true);
        }

        @Override
        public void destroy() {
            Disposable d = refresher;
            if (d != null) {
                d.dispose();
            }
        }
    }
}
