package com.collab.sync.collab.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Single {@link ObjectMapper} for WebSocket frames, event log records, the admin API
 * and the document store client.
 *
 * <h2>Key settings</h2>
 * <ul>
 *   <li>{@link JavaTimeModule}: event timestamps are {@code Instant}s.</li>
 *   <li>{@code WRITE_DATES_AS_TIMESTAMPS = false}: ISO-8601 text on the wire and in the log.</li>
 *   <li>{@code FAIL_ON_UNKNOWN_PROPERTIES = false}: clients and the document store may send
 *       fields this service does not model.</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
