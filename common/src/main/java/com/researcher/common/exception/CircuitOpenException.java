/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

import java.time.Instant;

/**
 * Fast-fail rejection: the circuit is open and the protected operation was not invoked.
 */
public class CircuitOpenException extends MessagingException {
    private final String circuitName;
    private final Instant retryAfter;

    public CircuitOpenException(String circuitName, Instant retryAfter) {
        super("MSG_CIRCUIT_OPEN", "Circuit '" + circuitName + "' is open until " + retryAfter);
        this.circuitName = circuitName;
        this.retryAfter = retryAfter;
    }

    public String getCircuitName() { return circuitName; }
    public Instant getRetryAfter() { return retryAfter; }
}
