/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import com.researcher.common.exception.CircuitOpenException;
import com.researcher.common.exception.PermanentException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrierTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    private static ExponentialBackoffStrategy strategy(int maxAttempts) {
        return new ExponentialBackoffStrategy(maxAttempts, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, () -> 0.5);
    }

    @Test
    void returnsFirstSuccessAfterTransientFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Callable<String> flaky = () -> {
            if (calls.incrementAndGet() < 3) throw new IOException("connection reset");
            return "done";
        };

        String result = new Retrier(strategy(3), recordingSleeper).wrap("flaky", flaky).call();

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void exhaustionCarriesAttemptCountAndLastError() {
        AtomicInteger calls = new AtomicInteger();
        Callable<String> broken = () -> {
            throw new IOException("failure " + calls.incrementAndGet());
        };

        assertThatThrownBy(() -> new Retrier(strategy(3), recordingSleeper).wrap("broken", broken).call())
                .isInstanceOfSatisfying(RetryExhaustedException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(3);
                    assertThat(e.getCause()).isInstanceOf(IOException.class).hasMessage("failure 3");
                });
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void permanentErrorStopsImmediately() {
        AtomicInteger calls = new AtomicInteger();
        Callable<String> rejected = () -> {
            calls.incrementAndGet();
            throw new PermanentException("schema mismatch");
        };

        assertThatThrownBy(() -> new Retrier(strategy(5), recordingSleeper).wrap("rejected", rejected).call())
                .isInstanceOf(RetryExhaustedException.class)
                .hasCauseInstanceOf(PermanentException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void openCircuitIsNotRetried() {
        CircuitBreaker breaker = new CircuitBreaker("test", 1, Duration.ofMinutes(1));
        AtomicInteger calls = new AtomicInteger();
        Callable<String> op = () -> {
            calls.incrementAndGet();
            throw new IOException("down");
        };
        Retrier retrier = new Retrier(strategy(5), recordingSleeper);

        assertThatThrownBy(() -> retrier.wrap("op", breaker.wrap(op)).call())
                .isInstanceOf(RetryExhaustedException.class)
                .hasCauseInstanceOf(CircuitOpenException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void interruptionDuringBackoffPropagates() {
        Sleeper interrupted = d -> {
            throw new InterruptedException("stop");
        };
        Callable<String> broken = () -> {
            throw new IOException("down");
        };

        assertThatThrownBy(() -> new Retrier(strategy(3), interrupted).wrap("op", broken).call())
                .isInstanceOf(InterruptedException.class);
    }
}
