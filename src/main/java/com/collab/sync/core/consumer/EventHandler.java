package com.collab.sync.core.consumer;

import com.collab.sync.core.model.StreamEntry;

/**
 * Business logic attached to an {@link EventConsumer}.
 *
 * <p>Returning normally means the entry is done and may be acknowledged. Throwing anything
 * means the attempt failed; the consumer retries and eventually dead-letters the entry.</p>
 */
@FunctionalInterface
public interface EventHandler {

    void handle(StreamEntry entry) throws Exception;
}
