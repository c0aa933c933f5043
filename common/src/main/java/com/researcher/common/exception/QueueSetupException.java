/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * Declaring or binding an exchange or queue failed.
 */
public class QueueSetupException extends MessagingException {
    public QueueSetupException(String message, Throwable cause) {
        super("MSG_TOPOLOGY", message, cause);
    }
}
