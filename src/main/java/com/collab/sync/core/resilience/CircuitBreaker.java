package com.collab.sync.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * =====================================================================
 * CircuitBreaker
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Stops calling a collaborator that keeps failing, and tries it again after a
 * recovery timeout.
 *
 * STATES
 * ------
 *   CLOSED     requests pass; {@code failureThreshold} consecutive failures → OPEN
 *   OPEN       requests rejected until {@code recoveryTimeout} has elapsed → HALF_OPEN
 *   HALF_OPEN  one trial call passes; success → CLOSED, failure → OPEN
 *
 * TIME
 * ----
 * All time reads go through the injected {@link Clock}.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0 but was: " + failureThreshold);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    /**
     * @return {@code true} if a request may be attempted now
     */
    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (Duration.between(openedAt, clock.instant()).compareTo(recoveryTimeout) < 0) {
                    return false;
                }
                state = State.HALF_OPEN;
                trialInFlight = true;
                log.info("Circuit {} half-open; probing", name);
                return true;
            case HALF_OPEN:
            default:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        if (state != State.CLOSED) {
            log.info("Circuit {} closed", name);
        }
        state = State.CLOSED;
        failureCount = 0;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        failureCount++;
        trialInFlight = false;
        if (state == State.HALF_OPEN || failureCount >= failureThreshold) {
            if (state != State.OPEN) {
                log.warn("Circuit {} opened after {} failures", name, failureCount);
            }
            state = State.OPEN;
            openedAt = clock.instant();
        }
    }

    public synchronized State state() {
        return state;
    }

    public synchronized int failureCount() {
        return failureCount;
    }

    public String name() {
        return name;
    }
}
