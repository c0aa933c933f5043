/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging;

import com.rabbitmq.client.ConnectionFactory;
import com.researcher.common.config.MessagingConfig;
import com.researcher.messaging.connection.RabbitConnection;
import com.researcher.messaging.consumer.MessageConsumer;
import com.researcher.messaging.health.HealthChecker;
import com.researcher.messaging.metrics.MessagingMetrics;
import com.researcher.messaging.publisher.MessagePublisher;
import com.researcher.messaging.topology.QueueSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicitly wired messaging stack for one service process.
 *
 * <pre>{@code
 * try (MessagingContext ctx = MessagingContext.start(MessagingConfig.load())) {
 *     ctx.publisher().publish(message, QueueName.CONTENT_DISCOVERED);
 * }
 * }</pre>
 *
 * Each context owns its connection and metrics, so several can coexist in one JVM.
 */
public class MessagingContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessagingContext.class);

    private final MessagingConfig config;
    private final RabbitConnection connection;
    private final MessagingMetrics metrics;
    private final QueueSetup queueSetup;
    private final MessagePublisher publisher;
    private final MessageConsumer consumer;
    private final HealthChecker healthChecker;

    public MessagingContext(MessagingConfig config, RabbitConnection connection, MessagingMetrics metrics,
                            MessagePublisher publisher) {
        this.config = config;
        this.connection = connection;
        this.metrics = metrics;
        this.queueSetup = new QueueSetup(connection, config);
        this.publisher = publisher;
        this.consumer = new MessageConsumer(connection, metrics, config);
        this.healthChecker = new HealthChecker(connection, queueSetup, metrics, config);
    }

    /** Connect, declare topology and wire the default publisher. */
    public static MessagingContext start(MessagingConfig config) {
        return start(config, new ConnectionFactory());
    }

    public static MessagingContext start(MessagingConfig config, ConnectionFactory factory) {
        config.validate();
        RabbitConnection connection = new RabbitConnection(config, factory);
        connection.connect();
        try {
            MessagingMetrics metrics = new MessagingMetrics();
            MessagingContext ctx = new MessagingContext(config, connection, metrics,
                    new MessagePublisher(connection, metrics));
            ctx.queueSetup.declareTopology();
            log.info("Messaging context started against {}:{}{}", config.getHost(), config.getPort(), config.getVirtualHost());
            return ctx;
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
    }

    public MessagingConfig config() { return config; }
    public RabbitConnection connection() { return connection; }
    public MessagingMetrics metrics() { return metrics; }
    public QueueSetup queueSetup() { return queueSetup; }
    public MessagePublisher publisher() { return publisher; }
    public MessageConsumer consumer() { return consumer; }
    public HealthChecker healthChecker() { return healthChecker; }

    /** Stops the consumer, then the publisher, then closes the connection. */
    @Override
    public void close() {
        try {
            consumer.close();
        } catch (RuntimeException e) {
            log.warn("Error stopping consumer: {}", e.getMessage());
        }
        publisher.close();
        connection.close();
        log.info("Messaging context closed");
    }
}
