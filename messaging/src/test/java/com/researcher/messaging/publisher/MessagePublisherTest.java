/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.publisher;

import com.researcher.common.config.MessagingConfig;
import com.researcher.common.exception.BrokerConnectionException;
import com.researcher.common.exception.CircuitOpenException;
import com.researcher.common.exception.ConfirmFailedException;
import com.researcher.common.exception.PublishException;
import com.researcher.common.model.QueueName;
import com.researcher.common.model.SourceMessage;
import com.researcher.common.model.SourceType;
import com.researcher.common.model.TrainingTriggerMessage;
import com.researcher.common.util.JsonUtil;
import com.researcher.messaging.connection.RabbitConnection;
import com.researcher.messaging.connection.Transaction;
import com.researcher.messaging.metrics.MessagingMetrics;
import com.researcher.messaging.resilience.CircuitBreaker;
import com.researcher.messaging.resilience.ExponentialBackoffStrategy;
import com.researcher.messaging.resilience.NoRetryStrategy;
import com.researcher.messaging.testing.InMemoryBroker;
import com.researcher.messaging.testing.MutableClock;
import com.researcher.messaging.topology.QueueSetup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessagePublisherTest {

    private InMemoryBroker broker;
    private MessagingConfig config;
    private RabbitConnection connection;
    private MessagingMetrics metrics;
    private MutableClock clock;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        config = new MessagingConfig();
        connection = new RabbitConnection(config, broker.connectionFactory());
        connection.connect();
        new QueueSetup(connection, config).declareTopology();
        metrics = new MessagingMetrics();
        clock = new MutableClock();
        sleeps = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    private MessagePublisher publisher(int maxAttempts, CircuitBreaker breaker) {
        return new MessagePublisher(connection, metrics,
                new ExponentialBackoffStrategy(maxAttempts, Duration.ofSeconds(1), Duration.ofSeconds(60)),
                breaker, sleeps::add);
    }

    private static SourceMessage discovery() {
        return new SourceMessage(SourceType.ARXIV, "https://arxiv.org/abs/2401.00001", "Sparse attention",
                "We propose a sparse attention mechanism.", Map.of("authors", List.of("A. Author")));
    }

    @Test
    void publishesPersistentJsonWithCorrelationId() throws Exception {
        SourceMessage message = discovery();

        publisher(3, null).publish(message, QueueName.CONTENT_DISCOVERED);

        InMemoryBroker.StoredMessage stored = broker.messages("content.discovered").get(0);
        assertThat(stored.exchange()).isEqualTo(QueueSetup.EXCHANGE);
        assertThat(stored.properties().getDeliveryMode()).isEqualTo(2);
        assertThat(stored.properties().getContentType()).isEqualTo("application/json");
        assertThat(stored.properties().getCorrelationId()).isEqualTo(message.getCorrelationId());
        assertThat(JsonUtil.fromBytes(stored.body(), SourceMessage.class)).isEqualTo(message);
        assertThat(metrics.getCounter("messages.published.content.discovered")).isEqualTo(1);
        assertThat(connection.isConfirmsEnabled()).isTrue();
    }

    @Test
    void publishWhileDisconnectedFailsFast() {
        MessagePublisher publisher = publisher(3, null);
        connection.close();

        assertThatThrownBy(() -> publisher.publish(discovery(), "content.discovered"))
                .isInstanceOf(BrokerConnectionException.class);
        assertThat(broker.publishAttempts()).isZero();
    }

    @Test
    void transientFailuresAreRetriedWithBackoff() {
        broker.failNextPublishes(2);

        publisher(3, null).publish(discovery(), "content.discovered");

        assertThat(broker.publishAttempts()).isEqualTo(3);
        assertThat(broker.messageCount("content.discovered")).isEqualTo(1);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void exhaustedRetriesRaisePublishErrorWithLastCause() {
        broker.failNextPublishes(10);

        assertThatThrownBy(() -> publisher(3, null).publish(discovery(), "content.discovered"))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining("after 3 attempt(s)")
                .hasCauseInstanceOf(IOException.class);
        assertThat(broker.publishAttempts()).isEqualTo(3);
        assertThat(metrics.getErrorSummary("content.discovered")).containsEntry("IOException", 1L);
        assertThat(metrics.getCounter("messages.published.content.discovered")).isZero();
    }

    @Test
    void nackedConfirmIsRetried() {
        broker.nackNextConfirms(1);

        publisher(3, null).publish(discovery(), "content.discovered");

        assertThat(broker.publishAttempts()).isEqualTo(2);
        assertThat(metrics.getCounter("messages.published.content.discovered")).isEqualTo(1);
    }

    @Test
    void nackedConfirmWithoutRetryFails() {
        broker.nackNextConfirms(1);
        MessagePublisher publisher = new MessagePublisher(connection, metrics, NoRetryStrategy.INSTANCE, null, sleeps::add);

        assertThatThrownBy(() -> publisher.publish(discovery(), "content.discovered"))
                .isInstanceOf(PublishException.class)
                .hasCauseInstanceOf(ConfirmFailedException.class);
    }

    @Test
    void openCircuitFailsWithoutTouchingTheBroker() {
        CircuitBreaker breaker = new CircuitBreaker("publisher", 2, Duration.ofSeconds(60), 1, clock);
        MessagePublisher publisher = new MessagePublisher(connection, metrics, NoRetryStrategy.INSTANCE, breaker, sleeps::add);
        broker.failNextPublishes(2);
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> publisher.publish(discovery(), "content.discovered"))
                    .isInstanceOf(PublishException.class);
        }
        int attempts = broker.publishAttempts();

        assertThatThrownBy(() -> publisher.publish(discovery(), "content.discovered"))
                .isInstanceOf(PublishException.class)
                .hasCauseInstanceOf(CircuitOpenException.class);
        assertThat(broker.publishAttempts()).isEqualTo(attempts);
        assertThat(publisher.healthCheck()).isFalse();
        assertThat(publisher.getStats().circuitState()).isEqualTo(CircuitBreaker.State.OPEN);

        clock.advance(Duration.ofSeconds(60));
        publisher.publish(discovery(), "content.discovered");
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(publisher.healthCheck()).isTrue();
    }

    @Test
    void resetCircuitBreakerRestoresPublishing() {
        CircuitBreaker breaker = new CircuitBreaker("publisher", 1, Duration.ofHours(1), 1, clock);
        MessagePublisher publisher = new MessagePublisher(connection, metrics, NoRetryStrategy.INSTANCE, breaker, sleeps::add);
        broker.failNextPublishes(1);
        assertThatThrownBy(() -> publisher.publish(discovery(), "content.discovered"));

        publisher.resetCircuitBreaker();
        publisher.publish(discovery(), "content.discovered");

        assertThat(broker.messageCount("content.discovered")).isEqualTo(1);
    }

    @Test
    void unroutableKeyLandsInAlternateExchangeQueue() {
        publisher(3, null).publish(discovery(), "content.unknown");

        assertThat(broker.messageCount(QueueSetup.UNROUTABLE_QUEUE)).isEqualTo(1);
        for (QueueName q : QueueName.values()) {
            assertThat(broker.messageCount(q.value())).as(q.value()).isZero();
        }
    }

    @Test
    void publishesInsideTransactionBecomeVisibleOnCommit() {
        MessagePublisher publisher = publisher(3, null);

        try (Transaction tx = connection.createTransaction()) {
            publisher.publish(new TrainingTriggerMessage("threshold_reached", 50, List.of()), QueueName.TRAINING_TRIGGER);
            publisher.publish(new TrainingTriggerMessage("manual", 0, List.of()), QueueName.TRAINING_TRIGGER);
            assertThat(broker.messageCount("training.trigger")).isZero();
            tx.commit();
        }

        assertThat(broker.messageCount("training.trigger")).isEqualTo(2);
    }

    @Test
    void asyncPublishCompletesAndPropagatesFailure() throws Exception {
        MessagePublisher publisher = publisher(1, null);

        publisher.publishAsync(discovery(), "content.discovered").get(5, TimeUnit.SECONDS);
        assertThat(broker.messageCount("content.discovered")).isEqualTo(1);

        broker.failNextPublishes(1);
        assertThatThrownBy(() -> publisher.publishAsync(discovery(), "content.discovered").get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(PublishException.class);
        publisher.close();
    }

    @Test
    void statsCountPublishedAndFailed() {
        MessagePublisher publisher = publisher(1, null);
        publisher.publish(discovery(), "content.discovered");
        broker.failNextPublishes(1);
        assertThatThrownBy(() -> publisher.publish(discovery(), "content.discovered"));

        PublisherStats stats = publisher.getStats();

        assertThat(stats.published()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.connected()).isTrue();
        assertThat(stats.circuitState()).isNull();
    }
}
