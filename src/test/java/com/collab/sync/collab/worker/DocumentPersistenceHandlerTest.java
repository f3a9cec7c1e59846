package com.collab.sync.collab.worker;

import com.collab.sync.collab.client.DocumentStoreClient;
import com.collab.sync.core.consumer.HandlerFailureException;
import com.collab.sync.core.event.Topics;
import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DocumentPersistenceHandlerTest {

    private final DocumentStoreClient store = mock(DocumentStoreClient.class);
    private final DocumentPersistenceHandler handler = new DocumentPersistenceHandler(store, Duration.ofSeconds(1));

    private static StreamEntry saved(Map<String, Object> payload) {
        return new StreamEntry(Topics.DOCUMENT, 3,
                new Event("document_saved", "doc-1", "alice", Instant.EPOCH, payload, null));
    }

    @Test
    void savesContentOfTheEvent() {
        when(store.save("doc-1", "hello")).thenReturn(Mono.empty());

        handler.handle(saved(Map.of("content", "hello", "revision", 4)));

        verify(store).save("doc-1", "hello");
    }

    @Test
    void missingContentFails() {
        assertThatThrownBy(() -> handler.handle(saved(Map.of("revision", 4))))
                .isInstanceOf(HandlerFailureException.class);
    }

    @Test
    void storeFailurePropagatesForRetry() {
        when(store.save("doc-1", "hello")).thenReturn(Mono.error(
                WebClientResponseException.create(503, "Service Unavailable", null, null, null)));

        assertThatThrownBy(() -> handler.handle(saved(Map.of("content", "hello"))))
                .isInstanceOf(WebClientResponseException.class);
    }
}
