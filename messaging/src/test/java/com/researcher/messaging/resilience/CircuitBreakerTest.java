/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import com.researcher.common.exception.CircuitOpenException;
import com.researcher.messaging.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        invocations = new AtomicInteger();
    }

    private Callable<String> failing() {
        return () -> {
            invocations.incrementAndGet();
            throw new IOException("broker down");
        };
    }

    private Callable<String> succeeding() {
        return () -> {
            invocations.incrementAndGet();
            return "ok";
        };
    }

    private CircuitBreaker breaker(int failureThreshold, int successThreshold) {
        return new CircuitBreaker("test", failureThreshold, Duration.ofSeconds(60), successThreshold, clock);
    }

    private static void fail(CircuitBreaker cb, Callable<String> op) {
        assertThatThrownBy(() -> cb.call(op)).isInstanceOf(IOException.class);
    }

    @Test
    void opensAfterExactlyThresholdConsecutiveFailures() {
        CircuitBreaker cb = breaker(3, 1);

        fail(cb, failing());
        fail(cb, failing());
        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        fail(cb, failing());

        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(cb.isOpen()).isTrue();
    }

    @Test
    void successWhileClosedResetsFailureCount() throws Exception {
        CircuitBreaker cb = breaker(3, 1);

        fail(cb, failing());
        fail(cb, failing());
        assertThat(cb.call(succeeding())).isEqualTo("ok");
        fail(cb, failing());
        fail(cb, failing());

        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(cb.getFailureCount()).isEqualTo(2);
    }

    @Test
    void openCircuitRejectsWithoutInvokingOperation() {
        CircuitBreaker cb = breaker(2, 1);
        fail(cb, failing());
        fail(cb, failing());
        invocations.set(0);

        assertThatThrownBy(() -> cb.call(succeeding()))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> assertThat(((CircuitOpenException) e).getRetryAfter())
                        .isEqualTo(clock.instant().plusSeconds(60)));
        assertThat(invocations).hasValue(0);
    }

    @Test
    void timeoutElapsedAdmitsTrialCallAndSuccessCloses() throws Exception {
        CircuitBreaker cb = breaker(2, 1);
        fail(cb, failing());
        fail(cb, failing());

        clock.advance(Duration.ofSeconds(59));
        assertThatThrownBy(() -> cb.call(succeeding())).isInstanceOf(CircuitOpenException.class);

        clock.advance(Duration.ofSeconds(1));
        assertThat(cb.call(succeeding())).isEqualTo("ok");
        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void halfOpenAdmitsOneTrialAtATime() throws Exception {
        CircuitBreaker cb = breaker(1, 1);
        fail(cb, failing());
        clock.advance(Duration.ofSeconds(60));

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> trial = CompletableFuture.supplyAsync(() -> {
            try {
                return cb.call(() -> {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return "recovered";
                });
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        });
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> cb.call(succeeding())).isInstanceOf(CircuitOpenException.class);
        assertThat(invocations).hasValue(1);
        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);

        release.countDown();
        assertThat(trial.get(5, TimeUnit.SECONDS)).isEqualTo("recovered");
        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(cb.call(succeeding())).isEqualTo("ok");
    }

    @Test
    void failureInHalfOpenReopensAndRestartsTimeout() {
        CircuitBreaker cb = breaker(2, 1);
        fail(cb, failing());
        fail(cb, failing());
        clock.advance(Duration.ofSeconds(61));

        fail(cb, failing());

        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        clock.advance(Duration.ofSeconds(30));
        assertThatThrownBy(() -> cb.call(succeeding())).isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void successThresholdRequiresConsecutiveTrialSuccesses() throws Exception {
        CircuitBreaker cb = breaker(1, 3);
        fail(cb, failing());
        clock.advance(Duration.ofSeconds(60));

        cb.call(succeeding());
        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        cb.call(succeeding());
        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        cb.call(succeeding());

        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void resetForcesClosed() throws Exception {
        CircuitBreaker cb = breaker(1, 1);
        fail(cb, failing());

        cb.reset();

        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(cb.call(succeeding())).isEqualTo("ok");
    }

    @Test
    void wrapComposesLazily() throws Exception {
        CircuitBreaker cb = breaker(1, 1);
        Callable<String> wrapped = cb.wrap(succeeding());

        assertThat(invocations).hasValue(0);
        assertThat(wrapped.call()).isEqualTo("ok");
        assertThat(invocations).hasValue(1);
    }

    @Test
    void rejectsNonPositiveThresholds() {
        assertThatThrownBy(() -> breaker(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> breaker(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
