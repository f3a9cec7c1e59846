package com.collab.sync.collab.worker;

import com.collab.sync.core.event.Topics;
import com.collab.sync.core.log.EventLog;
import com.collab.sync.core.log.InMemoryEventLog;
import com.collab.sync.core.model.Event;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsumerWorkersTest {

    @Test
    void startsOneConsumerPerTopicOnceAndStopsThemOnDestroy() throws Exception {
        InMemoryEventLog log = new InMemoryEventLog();
        ConsumerWorkerProperties props = new ConsumerWorkerProperties();
        props.setTopics(List.of(Topics.DOCUMENT, Topics.COLLABORATION));
        props.setBlock(Duration.ofMillis(50));
        props.setStopTimeout(Duration.ofSeconds(5));
        CountDownLatch handled = new CountDownLatch(2);

        ConsumerWorkers workers = new ConsumerWorkers(log, e -> handled.countDown(), props, "node-7");
        workers.onAppReady();
        workers.onEventLogReady();

        assertThat(workers.consumers()).hasSize(2)
                .allSatisfy(c -> assertThat(c.consumerName()).isEqualTo("node-7"));

        Event event = new Event("document_saved", "d", "u", Instant.EPOCH, null, null);
        log.append(Topics.DOCUMENT, event);
        log.append(Topics.COLLABORATION, event);
        assertThat(handled.await(5, TimeUnit.SECONDS)).isTrue();

        workers.destroy();

        assertThat(workers.consumers()).isEmpty();
        assertThat(log.groupInfo(Topics.DOCUMENT, props.getGroup()).ackedCount()).isEqualTo(1);
    }

    @Test
    void startPositionIsParsed() {
        ConsumerWorkerProperties props = new ConsumerWorkerProperties();
        assertThat(props.startPosition()).isEqualTo(EventLog.FROM_BEGINNING);

        props.setStart("latest");
        assertThat(props.toSettings().startPosition()).isEqualTo(EventLog.LATEST);

        props.setStart("tomorrow");
        assertThatThrownBy(props::startPosition).isInstanceOf(IllegalArgumentException.class);
    }
}
