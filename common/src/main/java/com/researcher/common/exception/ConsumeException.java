/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * A consumer could not be registered with the broker (queue missing, channel refused).
 */
public class ConsumeException extends MessagingException {
    public ConsumeException(String message) {
        super("MSG_CONSUME", message);
    }

    public ConsumeException(String message, Throwable cause) {
        super("MSG_CONSUME", message, cause);
    }
}
