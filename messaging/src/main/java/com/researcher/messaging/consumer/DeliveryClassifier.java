/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.consumer;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ShutdownSignalException;
import com.researcher.common.exception.ChannelClosedException;
import com.researcher.common.exception.ConnectionClosedException;
import com.researcher.common.exception.MessageValidationException;
import com.researcher.common.exception.PermanentException;
import com.researcher.common.exception.TransientException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps a processing failure to an ack/nack decision. The only place where exception types
 * are inspected on the consume path.
 *
 * <h3>Rules</h3>
 * <table>
 *   <tr><th>Failure</th><th>Outcome</th><th>Reason</th></tr>
 *   <tr><td>malformed JSON</td><td>DLQ</td><td>invalid_json</td></tr>
 *   <tr><td>schema violation</td><td>DLQ</td><td>validation_error</td></tr>
 *   <tr><td>{@link PermanentException}</td><td>DLQ</td><td>permanent_error</td></tr>
 *   <tr><td>{@link TransientException}</td><td>requeue</td><td>transient_error</td></tr>
 *   <tr><td>channel closed 405 (resource locked)</td><td>requeue</td><td>resource_locked</td></tr>
 *   <tr><td>channel closed 406 / 404 / 403</td><td>DLQ</td>
 *       <td>precondition_failed / queue_not_found / access_denied</td></tr>
 *   <tr><td>channel closed &gt;= 500</td><td>requeue</td><td>broker_error_&lt;code&gt;</td></tr>
 *   <tr><td>channel closed, other code</td><td>DLQ</td><td>channel_error_&lt;code&gt;</td></tr>
 *   <tr><td>connection closed</td><td>DLQ</td><td>connection_closed</td></tr>
 *   <tr><td>anything else</td><td>requeue</td><td>unknown_error</td></tr>
 * </table>
 */
public final class DeliveryClassifier {

    public DeliveryOutcome classify(Throwable failure) {
        if (failure == null) return DeliveryOutcome.ACK;
        Throwable error = unwrap(failure);

        if (error instanceof JsonParseException) {
            return DeliveryOutcome.deadLetter("invalid_json");
        }
        if (error instanceof MessageValidationException || error instanceof JsonProcessingException) {
            return DeliveryOutcome.deadLetter("validation_error");
        }
        if (error instanceof PermanentException) {
            return DeliveryOutcome.deadLetter("permanent_error");
        }
        if (error instanceof TransientException) {
            return DeliveryOutcome.requeue("transient_error");
        }
        if (error instanceof ConnectionClosedException) {
            return DeliveryOutcome.broker(DeliveryAction.NACK_DLQ, "connection_closed");
        }
        if (error instanceof ChannelClosedException cce) {
            return byReplyCode(cce.getReplyCode());
        }
        if (error instanceof ShutdownSignalException sse) {
            if (sse.isHardError()) {
                return DeliveryOutcome.broker(DeliveryAction.NACK_DLQ, "connection_closed");
            }
            if (sse.getReason() instanceof AMQP.Channel.Close close) {
                return byReplyCode(close.getReplyCode());
            }
            return DeliveryOutcome.broker(DeliveryAction.NACK_DLQ, "channel_error_unknown");
        }
        return DeliveryOutcome.requeue("unknown_error");
    }

    /** AMQP reply codes of a broker-initiated channel close. */
    public DeliveryOutcome byReplyCode(int replyCode) {
        return switch (replyCode) {
            case AMQP.RESOURCE_LOCKED -> DeliveryOutcome.broker(DeliveryAction.NACK_REQUEUE, "resource_locked");
            case AMQP.PRECONDITION_FAILED -> DeliveryOutcome.broker(DeliveryAction.NACK_DLQ, "precondition_failed");
            case AMQP.NOT_FOUND -> DeliveryOutcome.broker(DeliveryAction.NACK_DLQ, "queue_not_found");
            case AMQP.ACCESS_REFUSED -> DeliveryOutcome.broker(DeliveryAction.NACK_DLQ, "access_denied");
            default -> replyCode >= 500
                    ? DeliveryOutcome.broker(DeliveryAction.NACK_REQUEUE, "broker_error_" + replyCode)
                    : DeliveryOutcome.broker(DeliveryAction.NACK_DLQ, "channel_error_" + replyCode);
        };
    }

    /**
     * Strip async wrappers. A {@link JsonProcessingException} caused by a schema violation
     * in a message constructor classifies as the violation.
     */
    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof JsonProcessingException) {
            Throwable cause = current.getCause();
            while (cause != null) {
                if (cause instanceof MessageValidationException) return cause;
                cause = cause.getCause();
            }
        }
        return current;
    }
}
