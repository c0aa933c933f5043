/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@code min(max, base * factor^attempt)} with symmetric jitter of up to 20%.
 * The jittered delay never exceeds {@code max}.
 */
public class ExponentialBackoffStrategy extends AbstractRetryStrategy {

    public static final double JITTER = 0.2;

    private final double factor;
    private final DoubleSupplier random;

    public ExponentialBackoffStrategy() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(60));
    }

    public ExponentialBackoffStrategy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        this(maxAttempts, baseDelay, maxDelay, 2.0, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1)
     */
    public ExponentialBackoffStrategy(int maxAttempts, Duration baseDelay, Duration maxDelay,
                                      double factor, DoubleSupplier random) {
        super(maxAttempts, baseDelay, maxDelay);
        if (factor < 1.0) throw new IllegalArgumentException("factor must be >= 1");
        this.factor = factor;
        this.random = random;
    }

    @Override
    public Duration getBackoff(int attempt) {
        double base = baseDelay.toNanos() / 1e9;
        double max = maxDelay.toNanos() / 1e9;
        double delay = Math.min(max, base * Math.pow(factor, attempt));
        double jitter = delay * JITTER * (random.getAsDouble() * 2 - 1);
        double finalDelay = Math.max(0.0, Math.min(max, delay + jitter));
        log.debug("Backoff for attempt {}: {}s (base {}s, jitter {}s)", attempt,
                String.format("%.2f", finalDelay), String.format("%.2f", delay), String.format("%.2f", jitter));
        return seconds(finalDelay);
    }

    public double getFactor() { return factor; }
}
