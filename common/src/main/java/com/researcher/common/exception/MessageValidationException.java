/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * A message violated its schema. Raised at construction time so an invalid message never exists.
 */
public class MessageValidationException extends MessagingException {
    private final String field;

    public MessageValidationException(String field, String message) {
        super("MSG_VALIDATION", field + ": " + message);
        this.field = field;
    }

    public String getField() { return field; }
}
