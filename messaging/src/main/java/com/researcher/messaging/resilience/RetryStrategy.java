/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import java.time.Duration;

/**
 * Retry eligibility and backoff policy.
 *
 * <p>{@code attempt} is the number of attempts made so far: after the first failure the
 * caller asks {@code shouldRetry(1, error)} and waits {@code getBackoff(1)}.</p>
 */
public interface RetryStrategy {

    boolean shouldRetry(int attempt, Throwable error);

    Duration getBackoff(int attempt);
}
