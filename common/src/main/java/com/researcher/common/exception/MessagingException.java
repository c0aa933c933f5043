/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * Base exception for all messaging-layer errors.
 * Carries a stable error code so operators can group failures without parsing messages.
 */
public class MessagingException extends RuntimeException {
    private final String errorCode;

    public MessagingException(String message) {
        super(message);
        this.errorCode = "MSG_GENERIC";
    }

    public MessagingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MessagingException(String errorCode, String message, Throwable cause) {
        super(cause != null ? message + ": " + cause.getMessage() : message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
