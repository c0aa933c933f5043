/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import com.researcher.common.exception.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Consecutive-failure circuit breaker.
 *
 * <h3>Transitions</h3>
 * <ul>
 *   <li>CLOSED to OPEN after {@code failureThreshold} consecutive failures; a success while
 *       CLOSED resets the failure count to zero</li>
 *   <li>OPEN to HALF_OPEN on the first call after {@code timeout} has elapsed; until then
 *       calls are rejected with {@link CircuitOpenException} without running the operation</li>
 *   <li>HALF_OPEN to CLOSED after {@code successThreshold} consecutive successes</li>
 *   <li>HALF_OPEN to OPEN on any failure</li>
 * </ul>
 *
 * <p>HALF_OPEN admits one trial call at a time; callers arriving while a trial runs are
 * rejected like OPEN ones. With {@code successThreshold = 1} a single trial success closes
 * the circuit.</p>
 *
 * <p>State changes are synchronized; the protected operation runs outside the lock.</p>
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final String name;
    private final int failureThreshold;
    private final Duration timeout;
    private final int successThreshold;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration timeout) {
        this(name, failureThreshold, timeout, 1, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration timeout, int successThreshold, Clock clock) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("thresholds must be >= 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.timeout = timeout;
        this.successThreshold = successThreshold;
        this.clock = clock;
        log.debug("Circuit '{}' initialized (failureThreshold={}, timeout={}, successThreshold={})",
                name, failureThreshold, timeout, successThreshold);
    }

    /**
     * Run {@code operation} under protection.
     *
     * @throws CircuitOpenException when OPEN and the timeout has not elapsed
     * @throws Exception whatever the operation throws
     */
    public <T> T call(Callable<T> operation) throws Exception {
        boolean trial = acquirePermission();
        try {
            T result = operation.call();
            onSuccess();
            return result;
        } catch (Exception e) {
            onFailure(e);
            throw e;
        } finally {
            if (trial) releaseTrial();
        }
    }

    /** Breaker wrapper for explicit composition with {@link Retrier#wrap}. */
    public <T> Callable<T> wrap(Callable<T> operation) {
        return () -> call(operation);
    }

    /** @return whether the caller holds the HALF_OPEN trial slot */
    private synchronized boolean acquirePermission() {
        if (state == State.OPEN) {
            Instant retryAfter = openedAt.plus(timeout);
            if (clock.instant().isBefore(retryAfter)) {
                log.debug("Circuit '{}' is OPEN, rejecting call", name);
                throw new CircuitOpenException(name, retryAfter);
            }
            log.info("Circuit '{}' timeout elapsed, transitioning to HALF_OPEN", name);
            state = State.HALF_OPEN;
            failureCount = 0;
            successCount = 0;
            openedAt = null;
        }
        if (state == State.HALF_OPEN) {
            if (trialInFlight) {
                log.debug("Circuit '{}' trial call in progress, rejecting call", name);
                throw new CircuitOpenException(name, clock.instant());
            }
            trialInFlight = true;
            return true;
        }
        return false;
    }

    private synchronized void releaseTrial() {
        trialInFlight = false;
    }

    private synchronized void onSuccess() {
        switch (state) {
            case CLOSED -> failureCount = 0;
            case HALF_OPEN -> {
                successCount++;
                log.debug("Circuit '{}' success in HALF_OPEN ({}/{})", name, successCount, successThreshold);
                if (successCount >= successThreshold) {
                    log.info("Circuit '{}' closed after {} successful trial call(s)", name, successCount);
                    state = State.CLOSED;
                    failureCount = 0;
                    successCount = 0;
                }
            }
            case OPEN -> {
                // reset() or a concurrent trial failure reopened it while this call ran
            }
        }
    }

    private synchronized void onFailure(Exception e) {
        failureCount++;
        if (state == State.HALF_OPEN) {
            log.warn("Circuit '{}' failed in HALF_OPEN, reopening: {}", name, e.getMessage());
            open();
        } else if (state == State.CLOSED && failureCount >= failureThreshold) {
            log.warn("Circuit '{}' reached failure threshold ({}), opening: {}", name, failureThreshold,
                    e.getMessage());
            open();
        } else {
            log.debug("Circuit '{}' failure recorded (count {})", name, failureCount);
        }
    }

    private void open() {
        state = State.OPEN;
        openedAt = clock.instant();
        successCount = 0;
    }

    /** Force CLOSED, e.g. after the broker is known to have recovered. */
    public synchronized void reset() {
        state = State.CLOSED;
        trialInFlight = false;
        failureCount = 0;
        successCount = 0;
        openedAt = null;
        log.info("Circuit '{}' manually reset to CLOSED", name);
    }

    public synchronized State getState() { return state; }

    public synchronized boolean isOpen() { return state == State.OPEN; }

    public synchronized int getFailureCount() { return failureCount; }

    public String getName() { return name; }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{name=" + name + ", state=" + state + ", failures=" + failureCount
                + "/" + failureThreshold + "}";
    }
}
