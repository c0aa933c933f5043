/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import com.researcher.common.exception.MessagingException;

/**
 * The retry wrapper gave up. The cause is the last error observed.
 */
public class RetryExhaustedException extends MessagingException {
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super("MSG_RETRY_EXHAUSTED", operation + " failed after " + attempts + " attempt(s)", lastError);
        this.attempts = attempts;
    }

    public int getAttempts() { return attempts; }
}
