package com.collab.sync.collab.config;

import com.collab.sync.collab.client.DocumentStoreClient;
import com.collab.sync.collab.client.DocumentStoreProperties;
import com.collab.sync.collab.client.HttpDocumentStoreClient;
import com.collab.sync.collab.service.CollaborationService;
import com.collab.sync.collab.service.LiveDocumentRegistry;
import com.collab.sync.collab.worker.ConsumerWorkerProperties;
import com.collab.sync.core.deadletter.DeadLetterService;
import com.collab.sync.core.event.EventFamily;
import com.collab.sync.core.event.EventSchemaRegistry;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.core.log.InMemoryEventLog;
import com.collab.sync.core.monitor.EventLogMonitor;
import com.collab.sync.core.publisher.EventPublisher;
import com.collab.sync.core.resilience.CircuitBreaker;
import com.collab.sync.core.session.PresenceTracker;
import com.collab.sync.core.session.SessionManager;
import com.collab.sync.core.transform.TransformEngine;
import com.collab.sync.jetstream.config.CollabSyncProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * =====================================================================
 * CoreBeansConfig
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Wires the transport-independent core:
 *
 *   EventLog (memory | jetstream) → EventPublisher → CollaborationService
 *                                 → EventLogMonitor / DeadLetterService
 *   SessionManager → PresenceTracker
 *   DocumentStoreClient → LiveDocumentRegistry
 *
 * The JetStream {@link EventLog} comes from {@code NatsJetStreamConfig}; the
 * in-memory one below is the default when no back end is configured.
 */
@Configuration
@EnableConfigurationProperties({
        CollabSyncProperties.class,
        DocumentStoreProperties.class,
        ConsumerWorkerProperties.class,
        MonitorProperties.class
})
public class CoreBeansConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreBeansConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "collabsync.event-log", name = "backend",
            havingValue = CollabSyncProperties.BACKEND_MEMORY, matchIfMissing = true)
    public EventLog inMemoryEventLog(Clock clock) {
        log.info("Event log back end: in-memory (not durable across restarts)");
        return new InMemoryEventLog(clock);
    }

    @Bean
    public EventSchemaRegistry eventSchemaRegistry(CollabSyncProperties props) {
        Map<String, EventFamily> extra = new LinkedHashMap<>();
        props.getEvents().getExtraTypes().forEach((type, family) ->
                extra.put(type, EventFamily.valueOf(family.trim().toUpperCase(Locale.ROOT))));
        if (!extra.isEmpty()) {
            log.info("Registered extra event types {}", extra);
        }
        return new EventSchemaRegistry(extra);
    }

    @Bean
    public EventPublisher eventPublisher(EventLog eventLog, EventSchemaRegistry registry) {
        return new EventPublisher(eventLog, registry);
    }

    @Bean
    public TransformEngine transformEngine() {
        return new TransformEngine();
    }

    @Bean(destroyMethod = "shutdown")
    public SessionManager sessionManager(ObjectMapper mapper, Clock clock) {
        return new SessionManager(mapper, clock);
    }

    @Bean
    public PresenceTracker presenceTracker(SessionManager sessions, Clock clock) {
        return new PresenceTracker(sessions, clock);
    }

    @Bean(destroyMethod = "stop")
    public EventLogMonitor eventLogMonitor(EventLog eventLog, MonitorProperties props) {
        EventLogMonitor monitor = new EventLogMonitor(eventLog);
        if (props.isEnabled()) {
            monitor.startPeriodicCheck(props.getCheckInterval(), props.getDeadLetterThreshold());
        }
        return monitor;
    }

    @Bean
    public DeadLetterService deadLetterService(EventLog eventLog) {
        return new DeadLetterService(eventLog);
    }

    @Bean
    public CircuitBreaker documentStoreCircuitBreaker(DocumentStoreProperties props, Clock clock) {
        return new CircuitBreaker("document-store", props.getFailureThreshold(), props.getRecoveryTimeout(), clock);
    }

    @Bean
    public DocumentStoreClient documentStoreClient(WebClient.Builder builder, CircuitBreaker documentStoreCircuitBreaker,
                                                   DocumentStoreProperties props) {
        WebClient webClient = builder.baseUrl(props.getBaseUrl()).build();
        return new HttpDocumentStoreClient(webClient, documentStoreCircuitBreaker, props);
    }

    @Bean
    public LiveDocumentRegistry liveDocumentRegistry(DocumentStoreClient store, DocumentStoreProperties props) {
        return new LiveDocumentRegistry(store, props.getTimeout().multipliedBy(2));
    }

    @Bean(destroyMethod = "shutdown")
    public CollaborationService collaborationService(SessionManager sessions, PresenceTracker presence,
                                                     TransformEngine engine, EventPublisher publisher,
                                                     LiveDocumentRegistry documents, ObjectMapper mapper, Clock clock) {
        return new CollaborationService(sessions, presence, engine, publisher, documents, mapper, clock);
    }
}
