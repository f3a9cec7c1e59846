package com.collab.sync.collab.worker;

import com.collab.sync.collab.client.DocumentStoreClient;
import com.collab.sync.collab.client.DocumentStoreProperties;
import com.collab.sync.collab.service.CollaborationService;
import com.collab.sync.core.consumer.EventRouter;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.jetstream.config.CollabSyncProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Background workers. Off unless {@code collabsync.consumer.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "collabsync.consumer", name = "enabled", havingValue = "true")
public class ConsumerWorkerConfig {

    @Bean
    public EventRouter workerRouter(DocumentStoreClient store, DocumentStoreProperties storeProps) {
        return new EventRouter()
                .on(CollaborationService.EVENT_SAVED,
                        new DocumentPersistenceHandler(store, storeProps.getTimeout().multipliedBy(2)));
    }

    @Bean
    public ConsumerWorkers consumerWorkers(EventLog eventLog, EventRouter workerRouter,
                                           ConsumerWorkerProperties props, CollabSyncProperties collabProps) {
        return new ConsumerWorkers(eventLog, workerRouter, props, collabProps.getNodeId());
    }
}
