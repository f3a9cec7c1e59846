package com.collab.sync.core.event;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses the primary topic of an event from its type, using a fixed prefix table.
 *
 * <pre>
 * user_*              -> user_events
 * document_*          -> document_events
 * user_joined*        -> collaboration_events
 * user_left*          -> collaboration_events
 * document_changed*   -> collaboration_events
 * (no match)          -> dead_letter_events
 * </pre>
 *
 * <p>The prefixes overlap; the longest matching prefix wins, so collaboration events
 * never land on the user or document topics. Table order does not matter. A
 * first-match walk of the table above would send {@code user_joined_session} to
 * {@code user_events}; this router sends it to {@code collaboration_events}.</p>
 */
public final class TopicRouter {

    private static final Map<String, String> PREFIXES = new LinkedHashMap<>();

    static {
        PREFIXES.put("user_", Topics.USER);
        PREFIXES.put("document_", Topics.DOCUMENT);
        PREFIXES.put("user_joined", Topics.COLLABORATION);
        PREFIXES.put("user_left", Topics.COLLABORATION);
        PREFIXES.put("document_changed", Topics.COLLABORATION);
    }

    private static final List<String> BY_LENGTH = PREFIXES.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();

    public String route(String eventType) {
        for (String prefix : BY_LENGTH) {
            if (eventType.startsWith(prefix)) {
                return PREFIXES.get(prefix);
            }
        }
        return Topics.DEAD_LETTER;
    }
}
