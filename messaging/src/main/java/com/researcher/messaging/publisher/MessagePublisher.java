/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.rabbitmq.client.AMQP;
import com.researcher.common.config.MessagingConfig;
import com.researcher.common.exception.BrokerConnectionException;
import com.researcher.common.exception.ConfirmFailedException;
import com.researcher.common.exception.PublishException;
import com.researcher.common.model.BaseMessage;
import com.researcher.common.model.QueueName;
import com.researcher.common.util.JsonUtil;
import com.researcher.messaging.connection.RabbitConnection;
import com.researcher.messaging.connection.Transaction;
import com.researcher.messaging.metrics.MessagingMetrics;
import com.researcher.messaging.resilience.CircuitBreaker;
import com.researcher.messaging.resilience.ExponentialBackoffStrategy;
import com.researcher.messaging.resilience.Retrier;
import com.researcher.messaging.resilience.RetryExhaustedException;
import com.researcher.messaging.resilience.RetryStrategy;
import com.researcher.messaging.resilience.Sleeper;
import com.researcher.messaging.topology.QueueSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes validated messages to the {@code researcher} topic exchange.
 *
 * <h3>Per publish</h3>
 * <ol>
 *   <li>Fail fast with {@link BrokerConnectionException} when disconnected.</li>
 *   <li>Serialize to JSON. A serialization failure is final and never retried.</li>
 *   <li>Send as {@code retrier.wrap(breaker.wrap(send))}: the breaker sees every network
 *       attempt, the retry loop sleeps between attempts.</li>
 *   <li>With confirms enabled, wait for the broker ack on the shared channel.</li>
 * </ol>
 *
 * <p>Exhausted retries or an open circuit surface as {@link PublishException} carrying the
 * last cause. Inside {@link RabbitConnection#createTransaction()} on the calling thread,
 * sends go to the transaction's channel without confirms and become visible on commit.</p>
 */
public class MessagePublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessagePublisher.class);

    private final RabbitConnection connection;
    private final MessagingMetrics metrics;
    private final Retrier retrier;
    private final CircuitBreaker circuitBreaker;
    private final boolean confirms;
    private final long confirmTimeoutMs;

    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private volatile ExecutorService asyncExecutor;

    /**
     * Exponential backoff and a circuit breaker, both configured from the connection's config.
     */
    public MessagePublisher(RabbitConnection connection, MessagingMetrics metrics) {
        this(connection, metrics, defaultRetryStrategy(connection.getConfig()),
                defaultCircuitBreaker(connection.getConfig()), Sleeper.THREAD);
    }

    /**
     * @param circuitBreaker {@code null} to publish without one
     */
    public MessagePublisher(RabbitConnection connection, MessagingMetrics metrics, RetryStrategy retryStrategy,
                            CircuitBreaker circuitBreaker, Sleeper sleeper) {
        this.connection = connection;
        this.metrics = metrics;
        this.retrier = new Retrier(retryStrategy, sleeper);
        this.circuitBreaker = circuitBreaker;
        MessagingConfig config = connection.getConfig();
        this.confirms = config.isPublisherConfirms();
        this.confirmTimeoutMs = config.getConfirmTimeoutMs();
    }

    public static RetryStrategy defaultRetryStrategy(MessagingConfig config) {
        return new ExponentialBackoffStrategy(config.getPublishRetryMaxAttempts(),
                Duration.ofMillis(Math.round(config.getPublishRetryBaseDelaySeconds() * 1000)),
                Duration.ofMillis(Math.round(config.getPublishRetryMaxDelaySeconds() * 1000)));
    }

    public static CircuitBreaker defaultCircuitBreaker(MessagingConfig config) {
        return new CircuitBreaker("publisher", config.getCircuitBreakerFailureThreshold(),
                config.circuitBreakerTimeout(), config.getCircuitBreakerSuccessThreshold(), Clock.systemUTC());
    }

    // ─── Publish ────────────────────────────────────────────────────────

    public void publish(BaseMessage message, QueueName queue) {
        publish(message, queue.value(), false, false);
    }

    public void publish(BaseMessage message, String routingKey) {
        publish(message, routingKey, false, false);
    }

    /**
     * Publish one message.
     *
     * @param mandatory ask the broker to return the message when no queue is bound
     *                  (the alternate exchange normally catches it first)
     * @param immediate passed through to the broker; RabbitMQ rejects it
     * @throws BrokerConnectionException if not connected
     * @throws PublishException on serialization failure, exhausted retries or an open circuit
     */
    public void publish(BaseMessage message, String routingKey, boolean mandatory, boolean immediate) {
        if (!connection.hasOpenConnection()) {
            throw new BrokerConnectionException("Not connected to RabbitMQ. Call connect() first.");
        }

        byte[] body;
        try {
            body = JsonUtil.toBytes(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} {}", message.getClass().getSimpleName(), message.getCorrelationId(), e);
            failedCount.incrementAndGet();
            metrics.recordError(routingKey, "SerializationError");
            throw new PublishException("Message serialization failed", e);
        }

        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType("application/json")
                .contentEncoding("utf-8")
                .deliveryMode(2)
                .correlationId(message.getCorrelationId())
                .timestamp(Date.from(message.getCreatedAt()))
                .type(message.getClass().getSimpleName())
                .build();

        Callable<Void> send = () -> {
            send(routingKey, body, properties, mandatory, immediate);
            return null;
        };
        Callable<Void> guarded = circuitBreaker != null ? circuitBreaker.wrap(send) : send;

        try {
            retrier.wrap("publish to " + routingKey, guarded).call();
        } catch (RetryExhaustedException e) {
            Throwable last = e.getCause();
            fail(routingKey, last);
            log.error("Failed to publish to {} after {} attempt(s): {}", routingKey, e.getAttempts(),
                    last.getMessage());
            throw new PublishException("Failed to publish to " + routingKey + " after "
                    + e.getAttempts() + " attempt(s)", last);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(routingKey, e);
            throw new PublishException("Publish to " + routingKey + " interrupted", e);
        } catch (Exception e) {
            fail(routingKey, e);
            throw new PublishException("Failed to publish to " + routingKey, e);
        }

        publishedCount.incrementAndGet();
        metrics.recordMessagePublished(routingKey);
        log.debug("Published {} to {}", message.getCorrelationId(), routingKey);
    }

    private void send(String routingKey, byte[] body, AMQP.BasicProperties properties,
                      boolean mandatory, boolean immediate) throws Exception {
        Optional<Transaction> tx = connection.currentTransaction();
        if (tx.isPresent()) {
            tx.get().channel().basicPublish(QueueSetup.EXCHANGE, routingKey, mandatory, immediate, properties, body);
            return;
        }
        if (confirms) {
            connection.enablePublisherConfirms();
        }
        connection.withChannel(ch -> {
            ch.basicPublish(QueueSetup.EXCHANGE, routingKey, mandatory, immediate, properties, body);
            if (confirms && !ch.waitForConfirms(confirmTimeoutMs)) {
                throw new ConfirmFailedException(routingKey, "Broker nacked message for " + routingKey);
            }
            return null;
        });
    }

    private void fail(String routingKey, Throwable cause) {
        failedCount.incrementAndGet();
        metrics.recordError(routingKey, cause.getClass().getSimpleName());
    }

    /**
     * Publish on a background thread. The future fails with the same exceptions
     * {@link #publish(BaseMessage, String)} throws.
     */
    public CompletableFuture<Void> publishAsync(BaseMessage message, String routingKey) {
        return CompletableFuture.runAsync(() -> publish(message, routingKey), executor());
    }

    private ExecutorService executor() {
        ExecutorService ex = asyncExecutor;
        if (ex == null) {
            synchronized (this) {
                if (asyncExecutor == null) {
                    asyncExecutor = Executors.newSingleThreadExecutor(r -> {
                        Thread t = new Thread(r, "publisher-async");
                        t.setDaemon(true);
                        return t;
                    });
                }
                ex = asyncExecutor;
            }
        }
        return ex;
    }

    // ─── Health ─────────────────────────────────────────────────────────

    /** Connected, and the circuit (if any) is not open. */
    public boolean healthCheck() {
        try {
            if (circuitBreaker != null && circuitBreaker.isOpen()) {
                log.warn("Circuit breaker is open, publisher unhealthy");
                return false;
            }
            return connection.isConnected();
        } catch (RuntimeException e) {
            log.error("Publisher health check failed: {}", e.getMessage());
            return false;
        }
    }

    /** Force the circuit closed, e.g. after the broker is known to have recovered. */
    public void resetCircuitBreaker() {
        if (circuitBreaker != null) {
            circuitBreaker.reset();
            log.info("Publisher circuit breaker reset");
        }
    }

    public CircuitBreaker getCircuitBreaker() { return circuitBreaker; }

    public PublisherStats getStats() {
        return new PublisherStats(publishedCount.get(), failedCount.get(), connection.isConnected(),
                circuitBreaker != null ? circuitBreaker.getState() : null);
    }

    @Override
    public void close() {
        ExecutorService ex = asyncExecutor;
        if (ex != null) ex.shutdown();
    }

    @Override
    public String toString() {
        return "MessagePublisher{connected=" + connection.isConnected() + ", circuitBreaker="
                + (circuitBreaker != null ? circuitBreaker.getState() : "disabled") + "}";
    }
}
