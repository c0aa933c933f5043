/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * Thrown by application code when a failure cannot be fixed by trying again.
 *
 * <p>Publisher: not retried. Consumer: the message is rejected without requeue and
 * dead-lettered to the queue's DLQ.</p>
 */
public class PermanentException extends RuntimeException {
    public PermanentException(String message) {
        super(message);
    }

    public PermanentException(String message, Throwable cause) {
        super(message, cause);
    }
}
