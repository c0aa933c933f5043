/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.health;

import com.rabbitmq.client.AMQP;
import com.researcher.common.config.MessagingConfig;
import com.researcher.messaging.connection.RabbitConnection;
import com.researcher.messaging.metrics.MessagingMetrics;
import com.researcher.messaging.testing.InMemoryBroker;
import com.researcher.messaging.topology.QueueSetup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class HealthCheckerTest {

    private InMemoryBroker broker;
    private MessagingConfig config;
    private RabbitConnection connection;
    private MessagingMetrics metrics;
    private QueueSetup queueSetup;
    private HealthChecker checker;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        config = new MessagingConfig();
        connection = new RabbitConnection(config, broker.connectionFactory());
        connection.connect();
        queueSetup = new QueueSetup(connection, config);
        queueSetup.declareTopology();
        metrics = new MessagingMetrics();
        checker = new HealthChecker(connection, queueSetup, metrics, config);
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    private void fill(String queue, int count) {
        for (int i = 0; i < count; i++) {
            broker.publishRaw(QueueSetup.EXCHANGE, queue, "{}".getBytes(StandardCharsets.UTF_8));
        }
    }

    @Test
    void idleSystemIsHealthy() {
        HealthStatus health = checker.checkMessagingHealth();

        assertThat(health.getStatus()).isEqualTo(HealthStatus.Status.HEALTHY);
        assertThat(health.getChecks()).containsEntry("connection", "ok")
                .containsEntry("content.discovered.depth", "ok");
        assertThat(health.getMetrics()).containsKeys("queues", "metrics", "connection.status");
    }

    @Test
    void channelClosedByBrokerDegradesUntilReopened() throws Exception {
        connection.withChannel(ch -> {
            ch.basicPublish("researcher.missing", "digest.ready", new AMQP.BasicProperties(),
                    "{}".getBytes(StandardCharsets.UTF_8));
            return null;
        });
        await().atMost(Duration.ofSeconds(5)).until(() -> !connection.isConnected());

        HealthStatus health = checker.checkMessagingHealth();

        assertThat(health.getStatus()).isEqualTo(HealthStatus.Status.DEGRADED);
        assertThat(health.getChecks()).containsEntry("connection", "channel closed")
                .containsEntry("content.discovered.depth", "ok");

        connection.connect();

        assertThat(checker.checkMessagingHealth().getStatus()).isEqualTo(HealthStatus.Status.HEALTHY);
    }

    @Test
    void disconnectedIsUnhealthyAndSkipsQueueChecks() {
        connection.close();

        HealthStatus health = checker.checkMessagingHealth();

        assertThat(health.getStatus()).isEqualTo(HealthStatus.Status.UNHEALTHY);
        assertThat(health.getChecks()).containsEntry("connection", "failed");
        assertThat(health.getMetrics()).doesNotContainKey("queues");
        assertThat(checker.quickCheck()).isFalse();
    }

    @Test
    void queueAtWarningFractionOfMaxLengthIsDegraded() {
        fill("digest.ready", 79);
        assertThat(checker.checkMessagingHealth().getStatus()).isEqualTo(HealthStatus.Status.HEALTHY);

        fill("digest.ready", 1);
        HealthStatus health = checker.checkMessagingHealth();

        assertThat(health.getStatus()).isEqualTo(HealthStatus.Status.DEGRADED);
        assertThat(health.getChecks()).containsEntry("digest.ready.depth", "warning");
    }

    @Test
    void messagesInDeadLetterQueueDegrade() {
        broker.publishRaw(QueueSetup.DLQ_EXCHANGE, "feedback.submitted.dlq", "{}".getBytes(StandardCharsets.UTF_8));

        HealthStatus health = checker.checkMessagingHealth();

        assertThat(health.getStatus()).isEqualTo(HealthStatus.Status.DEGRADED);
        assertThat(health.getChecks()).containsEntry("feedback.submitted.dlq.count", "1 messages");
    }

    @Test
    void unroutableMessagesDegrade() {
        broker.publishRaw(QueueSetup.EXCHANGE, "nobody.listens", "{}".getBytes(StandardCharsets.UTF_8));

        assertThat(checker.checkMessagingHealth().getChecks())
                .containsEntry(QueueSetup.UNROUTABLE_QUEUE + ".count", "1 messages");
    }

    @Test
    void highErrorRateDegrades() {
        for (int i = 0; i < 10; i++) metrics.recordMessagePublished("content.discovered");
        metrics.recordError("content.discovered", "IOException");
        assertThat(checker.checkMessagingHealth().getStatus()).isEqualTo(HealthStatus.Status.HEALTHY);

        metrics.recordError("content.discovered", "IOException");
        HealthStatus health = checker.checkMessagingHealth();

        assertThat(health.getStatus()).isEqualTo(HealthStatus.Status.DEGRADED);
        assertThat(health.getChecks()).containsEntry("error_rate", "warning");
        assertThat((Double) health.getMetrics().get("error_rate")).isEqualTo(0.2);
    }

    @Test
    void missingQueuesAreSkipped() throws Exception {
        connection.withChannel(ch -> ch.queueDelete("digest.ready"));

        HealthStatus health = checker.checkMessagingHealth();

        assertThat(health.getChecks()).doesNotContainKey("digest.ready.depth");
    }

    @Test
    void statusSerializesLowercase() {
        fill("digest.ready", 100);

        HealthStatus health = checker.checkMessagingHealth();
        Map<String, Object> map = health.toMap();

        assertThat(map).containsEntry("status", "degraded").containsKeys("timestamp", "checks", "metrics");
        assertThat(health.toJson()).contains("\"status\":\"degraded\"");
    }

    @Test
    void quickCheckReflectsConnectivity() {
        assertThat(checker.quickCheck()).isTrue();
        broker.killConnections();
        assertThat(checker.quickCheck()).isFalse();
    }
}
