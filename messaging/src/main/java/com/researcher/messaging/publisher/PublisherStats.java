/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.publisher;

import com.researcher.messaging.resilience.CircuitBreaker;

/**
 * Point-in-time publisher statistics. {@code circuitState} is {@code null} without a breaker.
 */
public record PublisherStats(long published, long failed, boolean connected, CircuitBreaker.State circuitState) {
}
