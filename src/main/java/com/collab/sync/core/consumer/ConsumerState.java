package com.collab.sync.core.consumer;

/**
 * States of the per-entry consumer state machine.
 *
 * <pre>
 * IDLE → FETCHING → PROCESSING → (ACKED | RETRYING | DEAD_LETTERED) → IDLE
 *                        ▲              │
 *                        └──────────────┘  (after backoff)
 * </pre>
 */
public enum ConsumerState {
    IDLE,
    FETCHING,
    PROCESSING,
    ACKED,
    RETRYING,
    DEAD_LETTERED
}
