package com.collab.sync.collab.websocket;

import com.collab.sync.core.session.BroadcastDeliveryException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SinkConnectionTest {

    @Test
    void framesAreEmittedInOrderUntilClose() {
        SinkConnection connection = new SinkConnection("s1");
        connection.send("one");
        connection.send("two");
        connection.close();

        StepVerifier.create(connection.outbound())
                .expectNext("one", "two")
                .verifyComplete();
    }

    @Test
    void sendAfterCloseFails() {
        SinkConnection connection = new SinkConnection("s1");
        connection.close();

        assertThatThrownBy(() -> connection.send("late")).isInstanceOf(BroadcastDeliveryException.class);
    }
}
