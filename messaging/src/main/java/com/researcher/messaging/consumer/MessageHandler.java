/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.consumer;

import com.researcher.common.model.BaseMessage;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous handler for one queue's messages.
 *
 * <p>The outcome decides acknowledgement: completing normally acks; failing with
 * {@link com.researcher.common.exception.PermanentException} dead-letters; failing with
 * {@link com.researcher.common.exception.TransientException} or anything unclassified
 * requeues. A handler may also throw synchronously, with the same meaning.</p>
 */
@FunctionalInterface
public interface MessageHandler<T extends BaseMessage> {
    CompletionStage<Void> handle(T message);
}
