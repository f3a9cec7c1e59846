package com.collab.sync.core.log;

import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventLogTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String TOPIC = "document_events";

    private InMemoryEventLog log;

    @BeforeEach
    void setUp() {
        log = new InMemoryEventLog(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Event event(String subject) {
        return new Event("document_created", subject, null, NOW, Map.of("n", subject), null);
    }

    @Test
    void positionsStartAtOneAndIncrease() {
        assertThat(log.append(TOPIC, event("a"))).isEqualTo(1);
        assertThat(log.append(TOPIC, event("b"))).isEqualTo(2);
        assertThat(log.length(TOPIC)).isEqualTo(2);
        assertThat(log.length("missing")).isZero();
    }

    @Test
    void freshGroupFromBeginningReadsAllEntriesInOrder() {
        for (int i = 1; i <= 5; i++) {
            log.append(TOPIC, event("doc-" + i));
        }
        log.groupCreate(TOPIC, "g", EventLog.FROM_BEGINNING);

        List<StreamEntry> read = log.groupRead(TOPIC, "g", "c1", 10, Duration.ZERO);

        assertThat(read).extracting(StreamEntry::position).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(read).extracting(e -> e.event().subjectId())
                .containsExactly("doc-1", "doc-2", "doc-3", "doc-4", "doc-5");
    }

    @Test
    void groupsHaveIndependentCursors() {
        log.append(TOPIC, event("a"));
        log.append(TOPIC, event("b"));
        log.groupCreate(TOPIC, "g1", EventLog.FROM_BEGINNING);
        log.groupCreate(TOPIC, "g2", EventLog.FROM_BEGINNING);

        assertThat(log.groupRead(TOPIC, "g1", "c", 10, Duration.ZERO)).hasSize(2);
        assertThat(log.groupRead(TOPIC, "g2", "c", 1, Duration.ZERO)).extracting(StreamEntry::position)
                .containsExactly(1L);
        assertThat(log.groupRead(TOPIC, "g2", "c", 10, Duration.ZERO)).extracting(StreamEntry::position)
                .containsExactly(2L);
        assertThat(log.groupRead(TOPIC, "g1", "c", 10, Duration.ZERO)).isEmpty();
    }

    @Test
    void entryIsDeliveredToExactlyOneConsumerOfAGroup() {
        log.append(TOPIC, event("a"));
        log.groupCreate(TOPIC, "g", EventLog.FROM_BEGINNING);

        List<StreamEntry> first = log.groupRead(TOPIC, "g", "c1", 10, Duration.ZERO);
        List<StreamEntry> second = log.groupRead(TOPIC, "g", "c2", 10, Duration.ZERO);

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        assertThat(log.pending(TOPIC, "g")).singleElement()
                .satisfies(p -> {
                    assertThat(p.consumer()).isEqualTo("c1");
                    assertThat(p.deliveredAt()).isEqualTo(NOW);
                });
    }

    @Test
    void groupCreateIsIdempotent() {
        log.append(TOPIC, event("a"));
        log.groupCreate(TOPIC, "g", EventLog.FROM_BEGINNING);
        log.groupRead(TOPIC, "g", "c", 10, Duration.ZERO);

        log.groupCreate(TOPIC, "g", EventLog.FROM_BEGINNING);

        assertThat(log.groupRead(TOPIC, "g", "c", 10, Duration.ZERO)).isEmpty();
        assertThat(log.groups(TOPIC)).containsExactly("g");
    }

    @Test
    void latestGroupSkipsExistingEntries() {
        log.append(TOPIC, event("old"));
        log.groupCreate(TOPIC, "g", EventLog.LATEST);
        log.append(TOPIC, event("new"));

        assertThat(log.groupRead(TOPIC, "g", "c", 10, Duration.ZERO))
                .extracting(e -> e.event().subjectId()).containsExactly("new");
    }

    @Test
    void invalidStartPositionIsRejected() {
        assertThatThrownBy(() -> log.groupCreate(TOPIC, "g", -2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readingUnknownGroupFails() {
        log.append(TOPIC, event("a"));

        assertThatThrownBy(() -> log.groupRead(TOPIC, "nope", "c", 1, Duration.ZERO))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void ackRemovesPendingAndAdvancesFloor() {
        for (int i = 0; i < 3; i++) {
            log.append(TOPIC, event("e" + i));
        }
        log.groupCreate(TOPIC, "g", EventLog.FROM_BEGINNING);
        log.groupRead(TOPIC, "g", "c", 10, Duration.ZERO);

        assertThat(log.ack(TOPIC, "g", 2)).isTrue();
        assertThat(log.ack(TOPIC, "g", 2)).isFalse();
        GroupInfo partial = log.groupInfo(TOPIC, "g");
        assertThat(partial.pendingCount()).isEqualTo(2);
        assertThat(partial.ackFloor()).isZero();

        log.ack(TOPIC, "g", 1);
        log.ack(TOPIC, "g", 3);
        GroupInfo done = log.groupInfo(TOPIC, "g");
        assertThat(done.pendingCount()).isZero();
        assertThat(done.ackFloor()).isEqualTo(3);
        assertThat(done.ackedCount()).isEqualTo(3);
        assertThat(done.lastDeliveredPosition()).isEqualTo(3);
    }

    @Test
    void blockingReadWakesUpOnAppend() throws Exception {
        log.groupCreate(TOPIC, "g", EventLog.FROM_BEGINNING);

        CompletableFuture<List<StreamEntry>> read = CompletableFuture.supplyAsync(
                () -> log.groupRead(TOPIC, "g", "c", 10, Duration.ofSeconds(5)));
        Thread.sleep(100);
        log.append(TOPIC, event("late"));

        assertThat(read.get(5, TimeUnit.SECONDS)).extracting(e -> e.event().subjectId()).containsExactly("late");
    }

    @Test
    void readReverseReturnsNewestFirst() {
        log.append(TOPIC, event("a"));
        log.append(TOPIC, event("b"));
        log.append(TOPIC, event("c"));

        assertThat(log.readReverse(TOPIC, 2)).extracting(StreamEntry::position).containsExactly(3L, 2L);
        assertThat(log.readRange(TOPIC, 2, 5)).extracting(StreamEntry::position).containsExactly(2L, 3L);
    }
}
