/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.health;

import com.researcher.common.config.MessagingConfig;
import com.researcher.messaging.connection.RabbitConnection;
import com.researcher.messaging.metrics.MessagingMetrics;
import com.researcher.messaging.topology.QueueSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Aggregates connection, queue depth, error rate and dead-letter checks into one status.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>Connection down, or queue depths unreadable: {@code unhealthy}. Nothing else can
 *       improve this.</li>
 *   <li>A bounded queue at or above {@code health.queue-warning-fraction} of its max length:
 *       {@code degraded}.</li>
 *   <li>Errors per published message above {@code health.error-rate-threshold}:
 *       {@code degraded}.</li>
 *   <li>Any dead-letter queue, or the unroutable queue, holding a message: {@code degraded}.</li>
 * </ul>
 */
public class HealthChecker {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final RabbitConnection connection;
    private final QueueSetup queueSetup;
    private final MessagingMetrics metrics;
    private final double warningFraction;
    private final double errorRateThreshold;
    private final Clock clock;

    public HealthChecker(RabbitConnection connection, QueueSetup queueSetup, MessagingMetrics metrics,
                         MessagingConfig config) {
        this(connection, queueSetup, metrics, config, Clock.systemUTC());
    }

    public HealthChecker(RabbitConnection connection, QueueSetup queueSetup, MessagingMetrics metrics,
                         MessagingConfig config, Clock clock) {
        this.connection = connection;
        this.queueSetup = queueSetup;
        this.metrics = metrics;
        this.warningFraction = config.getHealthQueueWarningFraction();
        this.errorRateThreshold = config.getHealthErrorRateThreshold();
        this.clock = clock;
    }

    public HealthStatus checkMessagingHealth() {
        HealthStatus health = new HealthStatus(clock.instant());

        boolean connected = checkConnection(health);
        if (connected) {
            checkQueues(health);
        }
        checkErrorRate(health);

        log.info("Messaging health check: status={}, checks={}", health.getStatus().value(), health.getChecks().size());
        if (log.isDebugEnabled()) {
            log.debug("Messaging health detail: {}", health.toJson());
        }
        return health;
    }

    /** Connectivity only. Never throws. */
    public boolean quickCheck() {
        try {
            boolean connected = connection.isConnected();
            log.debug("Quick messaging health check: {}", connected);
            return connected;
        } catch (RuntimeException e) {
            log.debug("Quick messaging health check failed: {}", e.getMessage());
            return false;
        }
    }

    // ─── Checks ─────────────────────────────────────────────────────────

    private boolean checkConnection(HealthStatus health) {
        try {
            boolean connected = connection.hasOpenConnection();
            boolean channelOpen = connected && connection.isConnected();
            health.metric("connection.state", connection.getState().name());
            if (!connected) {
                health.check("connection", "failed");
                health.metric("connection.status", "disconnected");
                health.degrade(HealthStatus.Status.UNHEALTHY);
                log.warn("Messaging health check: connection failed");
            } else if (!channelOpen) {
                health.check("connection", "channel closed");
                health.metric("connection.status", "channel_closed");
                health.degrade(HealthStatus.Status.DEGRADED);
                log.warn("Messaging health check: shared channel closed by broker");
            } else {
                health.check("connection", "ok");
                health.metric("connection.status", "connected");
            }
            return connected;
        } catch (RuntimeException e) {
            health.check("connection", "failed: " + e.getMessage());
            health.metric("connection.status", "error");
            health.degrade(HealthStatus.Status.UNHEALTHY);
            log.error("Messaging health check: connection error: {}", e.getMessage());
            return false;
        }
    }

    private void checkQueues(HealthStatus health) {
        Map<String, Integer> depths;
        try {
            depths = queueSetup.getQueueDepths();
        } catch (RuntimeException e) {
            health.check("queues", "failed: " + e.getMessage());
            health.degrade(HealthStatus.Status.UNHEALTHY);
            log.error("Messaging health check: queue error: {}", e.getMessage());
            return;
        }
        health.metric("queues", depths);

        for (Map.Entry<String, Integer> entry : depths.entrySet()) {
            String queue = entry.getKey();
            int depth = entry.getValue();
            if (depth < 0) {
                continue;
            }
            if (queue.endsWith(".dlq")) {
                if (depth > 0) {
                    health.check(queue + ".count", depth + " messages");
                    health.degrade(HealthStatus.Status.DEGRADED);
                    log.warn("DLQ {} has {} messages", queue, depth);
                }
                continue;
            }
            int maxLength = queueSetup.maxLengthOf(queue);
            if (maxLength <= 0) {
                continue;
            }
            double threshold = maxLength * warningFraction;
            if (depth >= threshold) {
                health.check(queue + ".depth", "warning");
                health.degrade(HealthStatus.Status.DEGRADED);
                log.warn("Queue {} depth {} exceeds warning threshold {}", queue, depth, threshold);
            } else {
                health.check(queue + ".depth", "ok");
            }
        }
    }

    private void checkErrorRate(HealthStatus health) {
        health.metric("metrics", metrics.getSummary());
        long published = metrics.getTotalPublished();
        if (published == 0) {
            return;
        }
        double errorRate = (double) metrics.getTotalErrors() / published;
        health.metric("error_rate", errorRate);
        if (errorRate > errorRateThreshold) {
            health.check("error_rate", "warning");
            health.degrade(HealthStatus.Status.DEGRADED);
            log.warn("High error rate: {}", String.format("%.1f%%", errorRate * 100));
        } else {
            health.check("error_rate", "ok");
        }
    }
}
