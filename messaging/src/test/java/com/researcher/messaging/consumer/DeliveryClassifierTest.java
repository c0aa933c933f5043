/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.consumer;

import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.AMQImpl;
import com.researcher.common.exception.ChannelClosedException;
import com.researcher.common.exception.ConnectionClosedException;
import com.researcher.common.exception.MessageValidationException;
import com.researcher.common.exception.PermanentException;
import com.researcher.common.exception.TransientException;
import com.researcher.common.model.SourceMessage;
import com.researcher.common.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class DeliveryClassifierTest {

    private final DeliveryClassifier classifier = new DeliveryClassifier();

    private static Throwable deserializationFailure(String json) {
        return catchThrowable(() -> JsonUtil.fromBytes(json.getBytes(StandardCharsets.UTF_8), SourceMessage.class));
    }

    private static ShutdownSignalException channelClose(int code) {
        return new ShutdownSignalException(false, false, new AMQImpl.Channel.Close(code, "closed", 60, 40), null);
    }

    @Test
    void malformedJsonIsDeadLettered() {
        DeliveryOutcome outcome = classifier.classify(deserializationFailure("{not json"));

        assertThat(outcome).isEqualTo(DeliveryOutcome.deadLetter("invalid_json"));
    }

    @Test
    void schemaViolationIsDeadLettered() {
        Throwable failure = deserializationFailure("{\"source_type\":\"arxiv\",\"url\":\"\",\"title\":\"t\",\"content\":\"c\"}");

        assertThat(classifier.classify(failure)).isEqualTo(DeliveryOutcome.deadLetter("validation_error"));
        assertThat(classifier.classify(new MessageValidationException("url", "blank")))
                .isEqualTo(DeliveryOutcome.deadLetter("validation_error"));
    }

    @Test
    void handlerSignalledErrors() {
        assertThat(classifier.classify(new PermanentException("bad")))
                .isEqualTo(DeliveryOutcome.deadLetter("permanent_error"));
        assertThat(classifier.classify(new TransientException("busy")))
                .isEqualTo(DeliveryOutcome.requeue("transient_error"));
    }

    @Test
    void asyncWrappersAreUnwrapped() {
        assertThat(classifier.classify(new CompletionException(new PermanentException("bad"))).action())
                .isEqualTo(DeliveryAction.NACK_DLQ);
        assertThat(classifier.classify(new ExecutionException(new TransientException("busy"))).action())
                .isEqualTo(DeliveryAction.NACK_REQUEUE);
    }

    @Test
    void unknownErrorsAreRequeued() {
        DeliveryOutcome outcome = classifier.classify(new IllegalStateException("surprise"));

        assertThat(outcome.action()).isEqualTo(DeliveryAction.NACK_REQUEUE);
        assertThat(outcome.reason()).isEqualTo("unknown_error");
        assertThat(outcome.brokerOriginated()).isFalse();
    }

    @Test
    void channelReplyCodesMapToOutcomes() {
        assertThat(classifier.classify(channelClose(405))).isEqualTo(
                new DeliveryOutcome(DeliveryAction.NACK_REQUEUE, "resource_locked", true));
        assertThat(classifier.classify(channelClose(406)).reason()).isEqualTo("precondition_failed");
        assertThat(classifier.classify(channelClose(404)).reason()).isEqualTo("queue_not_found");
        assertThat(classifier.classify(channelClose(403)).reason()).isEqualTo("access_denied");
        assertThat(classifier.classify(channelClose(541))).isEqualTo(
                new DeliveryOutcome(DeliveryAction.NACK_REQUEUE, "broker_error_541", true));
        assertThat(classifier.classify(channelClose(320))).isEqualTo(
                new DeliveryOutcome(DeliveryAction.NACK_DLQ, "channel_error_320", true));
    }

    @Test
    void closedChannelAndConnectionExceptions() {
        assertThat(classifier.classify(new ChannelClosedException("gone", 406, "PRECONDITION_FAILED")).reason())
                .isEqualTo("precondition_failed");
        assertThat(classifier.classify(new ConnectionClosedException("gone", 320, "CONNECTION_FORCED")))
                .isEqualTo(new DeliveryOutcome(DeliveryAction.NACK_DLQ, "connection_closed", true));

        ShutdownSignalException hard = new ShutdownSignalException(true, false,
                new AMQImpl.Connection.Close(320, "CONNECTION_FORCED", 0, 0), null);
        assertThat(classifier.classify(hard).reason()).isEqualTo("connection_closed");
    }

    @Test
    void nullFailureIsAnAck() {
        assertThat(classifier.classify(null)).isEqualTo(DeliveryOutcome.ACK);
    }
}
