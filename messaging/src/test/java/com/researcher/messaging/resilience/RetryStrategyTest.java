/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import com.researcher.common.exception.CircuitOpenException;
import com.researcher.common.exception.MessageValidationException;
import com.researcher.common.exception.PermanentException;
import com.researcher.common.exception.TransientException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetryStrategyTest {

    @Test
    void exponentialBackoffStaysWithinJitterOfNominalDelay() {
        ExponentialBackoffStrategy s = new ExponentialBackoffStrategy(10, Duration.ofSeconds(1), Duration.ofSeconds(60));
        for (int k = 0; k < 10; k++) {
            double nominal = Math.min(60.0, Math.pow(2, k));
            for (int i = 0; i < 50; i++) {
                double actual = s.getBackoff(k).toNanos() / 1e9;
                assertThat(actual).isBetween(nominal * 0.8 - 1e-6, Math.min(60.0, nominal * 1.2) + 1e-6);
            }
        }
    }

    @Test
    void exponentialBackoffIsCappedAtMaxDelay() {
        ExponentialBackoffStrategy s = new ExponentialBackoffStrategy(3, Duration.ofSeconds(1),
                Duration.ofSeconds(10), 2.0, () -> 0.999);

        for (int k = 4; k < 40; k++) {
            assertThat(s.getBackoff(k)).isLessThanOrEqualTo(Duration.ofSeconds(10));
        }
    }

    @Test
    void exponentialBackoffWithoutJitterIsExact() {
        ExponentialBackoffStrategy s = new ExponentialBackoffStrategy(3, Duration.ofMillis(500),
                Duration.ofSeconds(60), 3.0, () -> 0.5);

        assertThat(s.getBackoff(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(s.getBackoff(1)).isEqualTo(Duration.ofMillis(1500));
        assertThat(s.getBackoff(2)).isEqualTo(Duration.ofMillis(4500));
    }

    @Test
    void linearBackoffGrowsByIncrementUpToMax() {
        LinearBackoffStrategy s = new LinearBackoffStrategy(5, Duration.ofSeconds(1), Duration.ofSeconds(2),
                Duration.ofSeconds(6));

        assertThat(s.getBackoff(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(s.getBackoff(1)).isEqualTo(Duration.ofSeconds(3));
        assertThat(s.getBackoff(2)).isEqualTo(Duration.ofSeconds(5));
        assertThat(s.getBackoff(3)).isEqualTo(Duration.ofSeconds(6));
    }

    @Test
    void noStrategyRetriesOnceAttemptsAreExhausted() {
        List<RetryStrategy> strategies = List.of(
                new ExponentialBackoffStrategy(),
                new LinearBackoffStrategy(),
                NoRetryStrategy.INSTANCE);
        Exception transientError = new TransientException("timeout");

        for (RetryStrategy s : strategies) {
            int max = s instanceof AbstractRetryStrategy a ? a.getMaxAttempts() : 0;
            for (int attempt = max; attempt < max + 5; attempt++) {
                assertThat(s.shouldRetry(attempt, transientError)).as("%s at %d", s, attempt).isFalse();
            }
        }
    }

    @Test
    void transientErrorsRetryBelowMaxAttempts() {
        ExponentialBackoffStrategy s = new ExponentialBackoffStrategy();

        assertThat(s.shouldRetry(1, new IOException("reset"))).isTrue();
        assertThat(s.shouldRetry(2, new TransientException("busy"))).isTrue();
        assertThat(s.shouldRetry(3, new IOException("reset"))).isFalse();
    }

    @Test
    void permanentErrorsAreNeverRetried() {
        ExponentialBackoffStrategy s = new ExponentialBackoffStrategy();

        assertThat(s.shouldRetry(1, new PermanentException("bad payload"))).isFalse();
        assertThat(s.shouldRetry(1, new MessageValidationException("url", "must not be blank"))).isFalse();
        assertThat(s.shouldRetry(1, new CircuitOpenException("publisher", Instant.now()))).isFalse();
        assertThat(s.shouldRetry(1, new InterruptedException())).isFalse();
    }

    @Test
    void noRetryStrategyNeverRetriesAndNeverWaits() {
        assertThat(NoRetryStrategy.INSTANCE.shouldRetry(0, new IOException())).isFalse();
        assertThat(NoRetryStrategy.INSTANCE.getBackoff(3)).isEqualTo(Duration.ZERO);
    }
}
