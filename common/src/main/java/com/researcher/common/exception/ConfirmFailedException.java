/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * The broker did not confirm a publish (nack or confirm timeout). Retryable.
 */
public class ConfirmFailedException extends MessagingException {
    private final String routingKey;

    public ConfirmFailedException(String routingKey, String message) {
        super("MSG_CONFIRM", message);
        this.routingKey = routingKey;
    }

    public String getRoutingKey() { return routingKey; }
}
