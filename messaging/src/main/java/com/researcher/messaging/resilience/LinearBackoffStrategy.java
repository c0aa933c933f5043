/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import java.time.Duration;

/**
 * {@code min(max, base + increment * attempt)}, no jitter.
 */
public class LinearBackoffStrategy extends AbstractRetryStrategy {

    private final Duration increment;

    public LinearBackoffStrategy() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(60));
    }

    public LinearBackoffStrategy(int maxAttempts, Duration baseDelay, Duration increment, Duration maxDelay) {
        super(maxAttempts, baseDelay, maxDelay);
        this.increment = increment;
    }

    @Override
    public Duration getBackoff(int attempt) {
        Duration delay = baseDelay.plus(increment.multipliedBy(attempt));
        if (delay.compareTo(maxDelay) > 0) delay = maxDelay;
        log.debug("Backoff for attempt {}: {}ms", attempt, delay.toMillis());
        return delay;
    }
}
