package com.collab.sync.core.consumer;

/**
 * Inspectable progress of the entry currently (or most recently) handled by a consumer.
 *
 * @param position  log position of the entry
 * @param attempts  handler invocations so far
 * @param state     state after the last transition
 * @param lastError message of the last handler failure, {@code null} if none
 */
public record Delivery(long position, int attempts, ConsumerState state, String lastError) {

    Delivery next(ConsumerState newState) {
        return new Delivery(position, attempts, newState, lastError);
    }
}
