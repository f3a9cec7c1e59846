package com.collab.sync.core.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps every known event type to exactly one {@link EventFamily}.
 *
 * <p>The built-in table mirrors the types the platform's services emit. Deployments can
 * register extra types at startup ({@code collabsync.events.extra-types}); re-registering a
 * type under a different family is rejected.</p>
 */
public class EventSchemaRegistry {

    private final Map<String, EventFamily> families = new ConcurrentHashMap<>();

    public EventSchemaRegistry() {
        register("user_registered", EventFamily.USER);
        register("user_updated", EventFamily.USER);
        register("user_deleted", EventFamily.USER);

        register("document_created", EventFamily.DOCUMENT);
        register("document_updated", EventFamily.DOCUMENT);
        register("document_shared", EventFamily.DOCUMENT);
        register("document_deleted", EventFamily.DOCUMENT);

        register("user_joined_session", EventFamily.COLLABORATION);
        register("user_left_session", EventFamily.COLLABORATION);
        register("document_changed", EventFamily.COLLABORATION);
        register("document_saved", EventFamily.COLLABORATION);
    }

    public EventSchemaRegistry(Map<String, EventFamily> extraTypes) {
        this();
        if (extraTypes != null) {
            extraTypes.forEach(this::register);
        }
    }

    public final void register(String eventType, EventFamily family) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        EventFamily existing = families.putIfAbsent(eventType, family);
        if (existing != null && existing != family) {
            throw new IllegalArgumentException(
                    "Event type " + eventType + " is already registered as " + existing + ", not " + family);
        }
    }

    public Optional<EventFamily> familyOf(String eventType) {
        return eventType == null ? Optional.empty() : Optional.ofNullable(families.get(eventType));
    }

    public boolean isKnown(String eventType) {
        return familyOf(eventType).isPresent();
    }

    public Map<String, EventFamily> all() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(families));
    }
}
