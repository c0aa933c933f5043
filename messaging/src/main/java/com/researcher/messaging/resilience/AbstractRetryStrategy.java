/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import com.researcher.common.exception.BrokerConnectionException;
import com.researcher.common.exception.CircuitOpenException;
import com.researcher.common.exception.MessageValidationException;
import com.researcher.common.exception.PermanentException;
import com.researcher.common.exception.PublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Shared attempt ceiling and error classification for the backoff strategies.
 *
 * <h3>Never retried</h3>
 * <ul>
 *   <li>{@link PermanentException} and {@link MessageValidationException}</li>
 *   <li>{@link PublishException} and {@link BrokerConnectionException}: already the outcome of
 *       an exhausted operation, or a dead connection the caller must re-establish</li>
 *   <li>{@link CircuitOpenException}: the breaker rejects without calling, so retrying
 *       inside the cooldown only burns attempts</li>
 *   <li>{@link InterruptedException}</li>
 * </ul>
 * Everything else is transient.
 */
public abstract class AbstractRetryStrategy implements RetryStrategy {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final int maxAttempts;
    protected final Duration baseDelay;
    protected final Duration maxDelay;

    protected AbstractRetryStrategy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    @Override
    public boolean shouldRetry(int attempt, Throwable error) {
        if (attempt >= maxAttempts) {
            log.debug("Max attempts ({}) reached, not retrying", maxAttempts);
            return false;
        }
        if (isPermanent(error)) {
            log.debug("Permanent error ({}), not retrying", error.getClass().getSimpleName());
            return false;
        }
        log.debug("Transient error ({}), retrying (attempt {}/{})",
                error.getClass().getSimpleName(), attempt + 1, maxAttempts);
        return true;
    }

    public static boolean isPermanent(Throwable error) {
        return error instanceof PermanentException
                || error instanceof MessageValidationException
                || error instanceof PublishException
                || error instanceof BrokerConnectionException
                || error instanceof CircuitOpenException
                || error instanceof InterruptedException;
    }

    public int getMaxAttempts() { return maxAttempts; }

    static Duration seconds(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }
}
