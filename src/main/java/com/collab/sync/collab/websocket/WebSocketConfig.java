package com.collab.sync.collab.websocket;

import com.collab.sync.collab.service.CollaborationService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

/**
 * Maps {@code /ws/collaborate/{documentId}} to the collaboration handler.
 */
@Configuration
public class WebSocketConfig {

    public static final String PATH = "/ws/collaborate/*";

    @Bean
    public IdentityResolver identityResolver() {
        return new HeaderIdentityResolver();
    }

    @Bean
    public CollaborationWebSocketHandler collaborationWebSocketHandler(CollaborationService service,
                                                                       IdentityResolver identityResolver) {
        return new CollaborationWebSocketHandler(service, identityResolver);
    }

    @Bean
    public HandlerMapping collaborationHandlerMapping(CollaborationWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of(PATH, handler), -1);
    }
}
