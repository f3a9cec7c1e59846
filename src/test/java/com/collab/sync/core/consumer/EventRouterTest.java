package com.collab.sync.core.consumer;

import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRouterTest {

    private static StreamEntry entry(String type) {
        return new StreamEntry("t", 1, new Event(type, "s", null, Instant.EPOCH, null, null));
    }

    @Test
    void dispatchesOnEventType() throws Exception {
        List<String> seen = new ArrayList<>();
        EventRouter router = new EventRouter()
                .on("document_saved", e -> seen.add("saved"))
                .on("document_changed", e -> seen.add("changed"));

        router.handle(entry("document_changed"));
        router.handle(entry("document_saved"));

        assertThat(seen).containsExactly("changed", "saved");
        assertThat(router.routedTypes()).containsExactlyInAnyOrder("document_saved", "document_changed");
    }

    @Test
    void unroutedTypeIsTreatedAsHandled() throws Exception {
        new EventRouter().handle(entry("user_joined_session"));
    }

    @Test
    void handlerFailurePropagates() {
        EventRouter router = new EventRouter().on("x", e -> {
            throw new HandlerFailureException("bad");
        });

        assertThatThrownBy(() -> router.handle(entry("x"))).isInstanceOf(HandlerFailureException.class);
    }
}
