/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.topology;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.researcher.common.config.MessagingConfig;
import com.researcher.common.exception.BrokerConnectionException;
import com.researcher.common.exception.QueueSetupException;
import com.researcher.common.model.QueueName;
import com.researcher.messaging.connection.QueueInfo;
import com.researcher.messaging.connection.RabbitConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Declares the broker topology. Every declaration is idempotent, so {@link #declareTopology()}
 * is safe on every service start.
 *
 * <h3>Topology</h3>
 * <ul>
 *   <li>{@code researcher}: durable topic exchange; its alternate exchange catches anything
 *       no binding matches</li>
 *   <li>{@code researcher.ae}: fanout alternate exchange, feeding {@code researcher.ae.dlq}
 *       (a message there means a routing misconfiguration)</li>
 *   <li>{@code researcher.dlq}: direct dead-letter exchange; each {@code <queue>.dlq} is bound
 *       under its own name</li>
 *   <li>each main queue is bound to {@code researcher} by its name and dead-letters into its
 *       companion DLQ; DLQs are unbounded with no TTL</li>
 * </ul>
 */
public class QueueSetup {

    private static final Logger log = LoggerFactory.getLogger(QueueSetup.class);

    public static final String EXCHANGE = "researcher";
    public static final String ALTERNATE_EXCHANGE = "researcher.ae";
    public static final String DLQ_EXCHANGE = "researcher.dlq";
    public static final String UNROUTABLE_QUEUE = "researcher.ae.dlq";

    private final RabbitConnection connection;
    private final List<QueueSpec> specs;

    public QueueSetup(RabbitConnection connection) {
        this(connection, connection.getConfig());
    }

    public QueueSetup(RabbitConnection connection, MessagingConfig config) {
        this.connection = connection;
        this.specs = QueueSpec.forConfig(config);
    }

    /**
     * Declare exchanges, queues and bindings.
     *
     * @throws QueueSetupException if any declaration or binding fails
     */
    public void declareTopology() {
        declare("exchange " + ALTERNATE_EXCHANGE,
                ch -> ch.exchangeDeclare(ALTERNATE_EXCHANGE, BuiltinExchangeType.FANOUT, true, false, null));
        declare("exchange " + EXCHANGE,
                ch -> ch.exchangeDeclare(EXCHANGE, BuiltinExchangeType.TOPIC, true, false,
                        Map.of("alternate-exchange", ALTERNATE_EXCHANGE)));
        declare("exchange " + DLQ_EXCHANGE,
                ch -> ch.exchangeDeclare(DLQ_EXCHANGE, BuiltinExchangeType.DIRECT, true, false, null));

        declare("queue " + UNROUTABLE_QUEUE, ch -> {
            ch.queueDeclare(UNROUTABLE_QUEUE, true, false, false, null);
            ch.queueBind(UNROUTABLE_QUEUE, ALTERNATE_EXCHANGE, "");
        });

        for (QueueName dlq : QueueName.deadLetterQueues()) {
            declare("queue " + dlq, ch -> {
                ch.queueDeclare(dlq.value(), true, false, false, null);
                ch.queueBind(dlq.value(), DLQ_EXCHANGE, dlq.value());
            });
        }

        for (QueueSpec spec : specs) {
            String name = spec.queue().value();
            declare("queue " + name, ch -> {
                ch.queueDeclare(name, true, false, false, spec.arguments());
                ch.queueBind(name, EXCHANGE, name);
            });
            log.debug("Declared queue {} with args {}", name, spec.arguments());
        }
        log.info("Messaging topology declared: {} main queues, {} DLQs", specs.size(),
                QueueName.deadLetterQueues().size());
    }

    @FunctionalInterface
    private interface Declaration {
        void apply(Channel channel) throws IOException;
    }

    private void declare(String what, Declaration declaration) {
        try {
            connection.withChannel(ch -> {
                declaration.apply(ch);
                return null;
            });
        } catch (BrokerConnectionException e) {
            throw new QueueSetupException("Cannot declare " + what, e);
        } catch (IOException | TimeoutException e) {
            log.error("Failed to declare {}", what, e);
            throw new QueueSetupException("Failed to declare " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueSetupException("Interrupted declaring " + what, e);
        }
    }

    // ─── Diagnostics ────────────────────────────────────────────────────

    /**
     * Ready-message count of every queue, including DLQs and the unroutable queue.
     * A queue that is missing or cannot be inspected reports -1.
     */
    public Map<String, Integer> getQueueDepths() {
        Map<String, Integer> depths = new LinkedHashMap<>();
        for (String name : allQueueNames()) {
            try {
                Optional<QueueInfo> info = connection.getQueueInfo(name);
                depths.put(name, info.map(QueueInfo::messageCount).orElse(-1));
            } catch (BrokerConnectionException e) {
                log.warn("Failed to get depth of {}: {}", name, e.getMessage());
                depths.put(name, -1);
            }
        }
        return depths;
    }

    /**
     * Whether each queue exists. Read-only: nothing is declared.
     */
    public Map<String, Boolean> checkQueuesExist() {
        Map<String, Boolean> exists = new LinkedHashMap<>();
        for (String name : allQueueNames()) {
            exists.put(name, connection.getQueueInfo(name).isPresent());
        }
        return exists;
    }

    /** Max length declared for a queue; 0 for unbounded queues. */
    public int maxLengthOf(String queueName) {
        return specs.stream()
                .filter(s -> s.queue().value().equals(queueName))
                .mapToInt(QueueSpec::maxLength)
                .findFirst()
                .orElse(0);
    }

    public List<QueueSpec> getSpecs() { return specs; }

    private static List<String> allQueueNames() {
        List<String> names = new ArrayList<>();
        for (QueueName q : QueueName.values()) names.add(q.value());
        names.add(UNROUTABLE_QUEUE);
        return names;
    }
}
