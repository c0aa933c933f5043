/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Retry wrapper: takes a callable and returns a callable that re-invokes it per a
 * {@link RetryStrategy}. Compose it explicitly with {@link CircuitBreaker#wrap}:
 *
 * <pre>{@code
 * Callable<Void> send = ...;
 * retrier.wrap("publish", breaker.wrap(send)).call();
 * }</pre>
 *
 * <p>{@link InterruptedException} from the sleeper propagates unchanged; any other final
 * failure surfaces as {@link RetryExhaustedException} carrying the last error.</p>
 */
public class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final RetryStrategy strategy;
    private final Sleeper sleeper;

    public Retrier(RetryStrategy strategy) {
        this(strategy, Sleeper.THREAD);
    }

    public Retrier(RetryStrategy strategy, Sleeper sleeper) {
        this.strategy = strategy;
        this.sleeper = sleeper;
    }

    public <T> Callable<T> wrap(String operation, Callable<T> action) {
        return () -> {
            int attempt = 0;
            while (true) {
                try {
                    T result = action.call();
                    if (attempt > 0) {
                        log.info("{} succeeded on attempt {}", operation, attempt + 1);
                    }
                    return result;
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    attempt++;
                    if (!strategy.shouldRetry(attempt, e)) {
                        throw new RetryExhaustedException(operation, attempt, e);
                    }
                    Duration backoff = strategy.getBackoff(attempt);
                    log.warn("{} attempt {} failed, retrying in {}ms: {}", operation, attempt,
                            backoff.toMillis(), e.getMessage());
                    sleeper.sleep(backoff);
                }
            }
        };
    }

    public RetryStrategy getStrategy() { return strategy; }
}
