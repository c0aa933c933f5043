/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * The broker closed a channel. The AMQP reply code decides whether a redelivery can help.
 */
public class ChannelClosedException extends MessagingException {
    private final int replyCode;
    private final String replyText;

    public ChannelClosedException(String message, int replyCode, String replyText) {
        super("MSG_CHANNEL_CLOSED", message + " [" + replyCode + "] " + replyText);
        this.replyCode = replyCode;
        this.replyText = replyText;
    }

    public int getReplyCode() { return replyCode; }
    public String getReplyText() { return replyText; }
}
