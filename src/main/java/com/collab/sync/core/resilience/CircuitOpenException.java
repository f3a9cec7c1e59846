package com.collab.sync.core.resilience;

import com.collab.sync.core.log.TransportException;

/**
 * A call was refused because its {@link CircuitBreaker} is open.
 */
public class CircuitOpenException extends TransportException {

    public CircuitOpenException(String circuit) {
        super("Circuit " + circuit + " is open");
    }
}
