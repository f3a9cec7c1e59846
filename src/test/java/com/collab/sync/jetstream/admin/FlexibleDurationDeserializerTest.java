package com.collab.sync.jetstream.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlexibleDurationDeserializerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private Duration read(String timeoutJson) throws Exception {
        String body = "{\"topic\":\"t\",\"group\":\"g\",\"consumer\":\"c\",\"timeout\":" + timeoutJson + "}";
        return mapper.readValue(body, EventLogAdminController.ReadRequest.class).timeout();
    }

    @Test
    void acceptsShorthandIsoAndMillis() throws Exception {
        assertThat(read("\"250ms\"")).isEqualTo(Duration.ofMillis(250));
        assertThat(read("\"5s\"")).isEqualTo(Duration.ofSeconds(5));
        assertThat(read("\"2m\"")).isEqualTo(Duration.ofMinutes(2));
        assertThat(read("\"PT3S\"")).isEqualTo(Duration.ofSeconds(3));
        assertThat(read("1500")).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void blankUsesDefault() throws Exception {
        assertThat(read("\"\"")).isEqualTo(FlexibleDurationDeserializer.DEFAULT);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> read("\"soon\"")).isInstanceOf(InvalidFormatException.class);
    }
}
