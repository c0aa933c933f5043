/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * Thrown by application code when a failure is expected to clear up on its own
 * (timeouts, a downstream service briefly unavailable).
 *
 * <p>Publisher: retried with backoff. Consumer: the message is rejected with requeue.</p>
 */
public class TransientException extends RuntimeException {
    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
