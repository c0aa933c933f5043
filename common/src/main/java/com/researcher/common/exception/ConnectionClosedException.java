/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * The broker closed the whole connection. Never worth a requeue: the channel is gone with it.
 */
public class ConnectionClosedException extends BrokerConnectionException {
    private final int replyCode;
    private final String replyText;

    public ConnectionClosedException(String message, int replyCode, String replyText) {
        super(message + " [" + replyCode + "] " + replyText);
        this.replyCode = replyCode;
        this.replyText = replyText;
    }

    public int getReplyCode() { return replyCode; }
    public String getReplyText() { return replyText; }
}
