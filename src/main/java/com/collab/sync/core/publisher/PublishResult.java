package com.collab.sync.core.publisher;

import com.collab.sync.core.model.Event;

/**
 * Outcome of a successful publish: the primary topic the event landed on and its position there.
 */
public record PublishResult(String topic, long position, Event event) {
}
