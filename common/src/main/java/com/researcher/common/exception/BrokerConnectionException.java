/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * Broker unreachable, connection lost, or an operation attempted on a dead channel.
 */
public class BrokerConnectionException extends MessagingException {
    public BrokerConnectionException(String message) {
        super("MSG_CONNECTION", message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super("MSG_CONNECTION", message, cause);
    }
}
