package com.collab.sync.core.deadletter;

import com.collab.sync.core.consumer.EventConsumer;
import com.collab.sync.core.event.Topics;
import com.collab.sync.core.log.InMemoryEventLog;
import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadLetterServiceTest {

    private InMemoryEventLog log;
    private DeadLetterService service;

    @BeforeEach
    void setUp() {
        log = new InMemoryEventLog();
        service = new DeadLetterService(log);
    }

    private static Event event(String type) {
        return new Event(type, "doc-1", "alice", Instant.parse("2024-05-01T10:00:00Z"), Map.of("content", "x"), null);
    }

    @Test
    void requeueCopiesToOriginalTopicWithoutDeadLetterHeaders() {
        log.append(Topics.DEAD_LETTER, event("document_saved").withHeaders(Map.of(
                EventConsumer.H_ORIGINAL_TOPIC, Topics.DOCUMENT,
                EventConsumer.H_ORIGINAL_POSITION, "4",
                EventConsumer.H_ATTEMPTS, "5",
                "trace-id", "abc")));

        StreamEntry requeued = service.requeue(1);

        assertThat(requeued.topic()).isEqualTo(Topics.DOCUMENT);
        assertThat(requeued.position()).isEqualTo(1);
        assertThat(requeued.event().headers())
                .containsEntry(DeadLetterService.H_REQUEUED_FROM, "1")
                .containsEntry("trace-id", "abc")
                .doesNotContainKeys(EventConsumer.H_ORIGINAL_TOPIC, EventConsumer.H_ATTEMPTS);
        assertThat(log.length(Topics.DOCUMENT)).isEqualTo(1);
        assertThat(service.depth()).isEqualTo(1);
    }

    @Test
    void missingEntryIsReported() {
        assertThatThrownBy(() -> service.requeue(9)).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void directlyRoutedEntryCannotBeRequeued() {
        log.append(Topics.DEAD_LETTER, event("mystery_event"));

        assertThatThrownBy(() -> service.requeue(1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listReturnsNewestFirst() {
        log.append(Topics.DEAD_LETTER, event("a_event"));
        log.append(Topics.DEAD_LETTER, event("b_event"));

        assertThat(service.list(10)).extracting(e -> e.event().eventType()).containsExactly("b_event", "a_event");
    }
}
