/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.exception;

/**
 * Publishing failed for good: serialization failed, retries ran out, or the circuit was open.
 * The last underlying failure is always available as the cause when there was one.
 */
public class PublishException extends MessagingException {
    public PublishException(String message) {
        super("MSG_PUBLISH", message);
    }

    public PublishException(String message, Throwable cause) {
        super("MSG_PUBLISH", message, cause);
    }
}
