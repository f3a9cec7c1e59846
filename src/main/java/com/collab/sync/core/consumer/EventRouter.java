package com.collab.sync.core.consumer;

import com.collab.sync.core.model.StreamEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link EventHandler} that dispatches on {@code event_type}.
 *
 * <p>Entries with no registered route are logged and treated as handled, so they are
 * acknowledged instead of being retried into the dead-letter topic.</p>
 */
public class EventRouter implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final Map<String, EventHandler> routes = new ConcurrentHashMap<>();

    public EventRouter on(String eventType, EventHandler handler) {
        routes.put(eventType, handler);
        return this;
    }

    public Set<String> routedTypes() {
        return Set.copyOf(routes.keySet());
    }

    @Override
    public void handle(StreamEntry entry) throws Exception {
        EventHandler handler = routes.get(entry.event().eventType());
        if (handler == null) {
            log.info("No route for event type={} topic={} position={}; skipping",
                    entry.event().eventType(), entry.topic(), entry.position());
            return;
        }
        handler.handle(entry);
    }
}
