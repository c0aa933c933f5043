/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import java.time.Duration;

/**
 * Fail fast: never retry, never wait.
 */
public final class NoRetryStrategy implements RetryStrategy {

    public static final NoRetryStrategy INSTANCE = new NoRetryStrategy();

    private NoRetryStrategy() {}

    @Override
    public boolean shouldRetry(int attempt, Throwable error) { return false; }

    @Override
    public Duration getBackoff(int attempt) { return Duration.ZERO; }
}
