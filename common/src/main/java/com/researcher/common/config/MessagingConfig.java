/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.config;

import com.researcher.common.config.PropertyResolver.ConfigResolutionException;

import java.time.Duration;

/**
 * RabbitMQ connection, topology, retry, circuit-breaker, consumer and health settings.
 *
 * <p>Defaults match a local development broker. {@link #load()} reads
 * {@code messaging.properties} from the classpath; every value there may be a
 * {@code ${ENV_VAR:default}} placeholder resolved by {@link PropertyResolver}.</p>
 *
 * <h3>Keys</h3>
 * <pre>
 *   messaging.rabbitmq.host / port / user / password / virtual-host
 *   messaging.rabbitmq.heartbeat-seconds / connection-timeout-seconds
 *   messaging.rabbitmq.automatic-recovery / network-recovery-interval-ms
 *   messaging.queue.max-length / message-ttl-ms (empty = no expiry)
 *   messaging.publish.retry.max-attempts / base-delay-seconds / max-delay-seconds
 *   messaging.publish.confirms / confirm-timeout-ms
 *   messaging.circuit-breaker.failure-threshold / timeout-seconds / success-threshold
 *   messaging.consumer.prefetch-count / worker-threads / poll-interval-ms
 *   messaging.health.queue-warning-fraction / error-rate-threshold
 * </pre>
 */
public class MessagingConfig {

    public static final String DEFAULT_RESOURCE = "messaging.properties";

    // ─── Connection ─────────────────────────────────────────────────
    private String host = "localhost";
    private int port = 5672;
    private String user = "guest";
    private String password = "guest";
    private String virtualHost = "/";
    private int heartbeatSeconds = 60;
    private int connectionTimeoutSeconds = 30;
    private boolean automaticRecovery = true;
    private long networkRecoveryIntervalMs = 5000;

    // ─── Queues ─────────────────────────────────────────────────────
    private int queueMaxLength = 10000;
    private Long queueMessageTtlMs = 86_400_000L;

    // ─── Publishing ─────────────────────────────────────────────────
    private int publishRetryMaxAttempts = 3;
    private double publishRetryBaseDelaySeconds = 1.0;
    private double publishRetryMaxDelaySeconds = 60.0;
    private boolean publisherConfirms = true;
    private long confirmTimeoutMs = 5000;

    // ─── Circuit breaker ────────────────────────────────────────────
    private int circuitBreakerFailureThreshold = 3;
    private double circuitBreakerTimeoutSeconds = 60.0;
    private int circuitBreakerSuccessThreshold = 1;

    // ─── Consumer ───────────────────────────────────────────────────
    private int consumerPrefetchCount = 10;
    private int consumerWorkerThreads = 0;
    private long consumerPollIntervalMs = 100;

    // ─── Health ─────────────────────────────────────────────────────
    private double healthQueueWarningFraction = 0.8;
    private double healthErrorRateThreshold = 0.1;

    public MessagingConfig() {}

    /**
     * Load from {@code messaging.properties} on the classpath, falling back to defaults
     * for absent keys.
     */
    public static MessagingConfig load() {
        PropertyResolver resolver = new PropertyResolver();
        resolver.loadClasspathProperties(DEFAULT_RESOURCE);
        return from(resolver);
    }

    public static MessagingConfig from(PropertyResolver resolver) {
        MessagingConfig c = new MessagingConfig();
        Reader r = new Reader(resolver);

        c.host = r.string("messaging.rabbitmq.host", c.host);
        c.port = r.integer("messaging.rabbitmq.port", c.port);
        c.user = r.string("messaging.rabbitmq.user", c.user);
        c.password = r.string("messaging.rabbitmq.password", c.password);
        c.virtualHost = r.string("messaging.rabbitmq.virtual-host", c.virtualHost);
        c.heartbeatSeconds = r.integer("messaging.rabbitmq.heartbeat-seconds", c.heartbeatSeconds);
        c.connectionTimeoutSeconds = r.integer("messaging.rabbitmq.connection-timeout-seconds", c.connectionTimeoutSeconds);
        c.automaticRecovery = r.bool("messaging.rabbitmq.automatic-recovery", c.automaticRecovery);
        c.networkRecoveryIntervalMs = r.longValue("messaging.rabbitmq.network-recovery-interval-ms", c.networkRecoveryIntervalMs);

        c.queueMaxLength = r.integer("messaging.queue.max-length", c.queueMaxLength);
        c.queueMessageTtlMs = r.optionalLong("messaging.queue.message-ttl-ms", c.queueMessageTtlMs);

        c.publishRetryMaxAttempts = r.integer("messaging.publish.retry.max-attempts", c.publishRetryMaxAttempts);
        c.publishRetryBaseDelaySeconds = r.decimal("messaging.publish.retry.base-delay-seconds", c.publishRetryBaseDelaySeconds);
        c.publishRetryMaxDelaySeconds = r.decimal("messaging.publish.retry.max-delay-seconds", c.publishRetryMaxDelaySeconds);
        c.publisherConfirms = r.bool("messaging.publish.confirms", c.publisherConfirms);
        c.confirmTimeoutMs = r.longValue("messaging.publish.confirm-timeout-ms", c.confirmTimeoutMs);

        c.circuitBreakerFailureThreshold = r.integer("messaging.circuit-breaker.failure-threshold", c.circuitBreakerFailureThreshold);
        c.circuitBreakerTimeoutSeconds = r.decimal("messaging.circuit-breaker.timeout-seconds", c.circuitBreakerTimeoutSeconds);
        c.circuitBreakerSuccessThreshold = r.integer("messaging.circuit-breaker.success-threshold", c.circuitBreakerSuccessThreshold);

        c.consumerPrefetchCount = r.integer("messaging.consumer.prefetch-count", c.consumerPrefetchCount);
        c.consumerWorkerThreads = r.integer("messaging.consumer.worker-threads", c.consumerWorkerThreads);
        c.consumerPollIntervalMs = r.longValue("messaging.consumer.poll-interval-ms", c.consumerPollIntervalMs);

        c.healthQueueWarningFraction = r.decimal("messaging.health.queue-warning-fraction", c.healthQueueWarningFraction);
        c.healthErrorRateThreshold = r.decimal("messaging.health.error-rate-threshold", c.healthErrorRateThreshold);

        c.validate();
        return c;
    }

    /**
     * @throws ConfigResolutionException if any value is out of range
     */
    public void validate() {
        if (queueMaxLength < 0) {
            throw new ConfigResolutionException("messaging.queue.max-length must be >= 0, got " + queueMaxLength);
        }
        if (queueMessageTtlMs != null && queueMessageTtlMs <= 0) {
            throw new ConfigResolutionException("messaging.queue.message-ttl-ms must be > 0, got " + queueMessageTtlMs);
        }
        if (port <= 0 || port > 65535) {
            throw new ConfigResolutionException("messaging.rabbitmq.port out of range: " + port);
        }
        if (publishRetryMaxAttempts < 0) {
            throw new ConfigResolutionException("messaging.publish.retry.max-attempts must be >= 0");
        }
        if (circuitBreakerFailureThreshold < 1 || circuitBreakerSuccessThreshold < 1) {
            throw new ConfigResolutionException("circuit-breaker thresholds must be >= 1");
        }
        if (consumerPrefetchCount < 1) {
            throw new ConfigResolutionException("messaging.consumer.prefetch-count must be >= 1");
        }
        if (healthQueueWarningFraction <= 0 || healthQueueWarningFraction > 1) {
            throw new ConfigResolutionException("messaging.health.queue-warning-fraction must be in (0, 1]");
        }
    }

    /**
     * AMQP URL for logging and external tools. The root virtual host renders as an empty path.
     */
    public String connectionUrl() {
        String vhost = "/".equals(virtualHost) ? "" : virtualHost.replaceFirst("^/+", "");
        return "amqp://" + user + ":" + password + "@" + host + ":" + port + "/" + vhost;
    }

    /** Worker pool size for consumers: explicit setting, or one worker per prefetch slot. */
    public int effectiveConsumerWorkers() {
        return consumerWorkerThreads > 0 ? consumerWorkerThreads : consumerPrefetchCount;
    }

    public Duration circuitBreakerTimeout() {
        return Duration.ofMillis(Math.round(circuitBreakerTimeoutSeconds * 1000));
    }

    // --- Getters and Setters ---
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getVirtualHost() { return virtualHost; }
    public void setVirtualHost(String virtualHost) { this.virtualHost = virtualHost; }
    public int getHeartbeatSeconds() { return heartbeatSeconds; }
    public void setHeartbeatSeconds(int heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }
    public int getConnectionTimeoutSeconds() { return connectionTimeoutSeconds; }
    public void setConnectionTimeoutSeconds(int connectionTimeoutSeconds) { this.connectionTimeoutSeconds = connectionTimeoutSeconds; }
    public boolean isAutomaticRecovery() { return automaticRecovery; }
    public void setAutomaticRecovery(boolean automaticRecovery) { this.automaticRecovery = automaticRecovery; }
    public long getNetworkRecoveryIntervalMs() { return networkRecoveryIntervalMs; }
    public void setNetworkRecoveryIntervalMs(long networkRecoveryIntervalMs) { this.networkRecoveryIntervalMs = networkRecoveryIntervalMs; }

    public int getQueueMaxLength() { return queueMaxLength; }
    public void setQueueMaxLength(int queueMaxLength) { this.queueMaxLength = queueMaxLength; }
    public Long getQueueMessageTtlMs() { return queueMessageTtlMs; }
    public void setQueueMessageTtlMs(Long queueMessageTtlMs) { this.queueMessageTtlMs = queueMessageTtlMs; }

    public int getPublishRetryMaxAttempts() { return publishRetryMaxAttempts; }
    public void setPublishRetryMaxAttempts(int publishRetryMaxAttempts) { this.publishRetryMaxAttempts = publishRetryMaxAttempts; }
    public double getPublishRetryBaseDelaySeconds() { return publishRetryBaseDelaySeconds; }
    public void setPublishRetryBaseDelaySeconds(double publishRetryBaseDelaySeconds) { this.publishRetryBaseDelaySeconds = publishRetryBaseDelaySeconds; }
    public double getPublishRetryMaxDelaySeconds() { return publishRetryMaxDelaySeconds; }
    public void setPublishRetryMaxDelaySeconds(double publishRetryMaxDelaySeconds) { this.publishRetryMaxDelaySeconds = publishRetryMaxDelaySeconds; }
    public boolean isPublisherConfirms() { return publisherConfirms; }
    public void setPublisherConfirms(boolean publisherConfirms) { this.publisherConfirms = publisherConfirms; }
    public long getConfirmTimeoutMs() { return confirmTimeoutMs; }
    public void setConfirmTimeoutMs(long confirmTimeoutMs) { this.confirmTimeoutMs = confirmTimeoutMs; }

    public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
    public void setCircuitBreakerFailureThreshold(int circuitBreakerFailureThreshold) { this.circuitBreakerFailureThreshold = circuitBreakerFailureThreshold; }
    public double getCircuitBreakerTimeoutSeconds() { return circuitBreakerTimeoutSeconds; }
    public void setCircuitBreakerTimeoutSeconds(double circuitBreakerTimeoutSeconds) { this.circuitBreakerTimeoutSeconds = circuitBreakerTimeoutSeconds; }
    public int getCircuitBreakerSuccessThreshold() { return circuitBreakerSuccessThreshold; }
    public void setCircuitBreakerSuccessThreshold(int circuitBreakerSuccessThreshold) { this.circuitBreakerSuccessThreshold = circuitBreakerSuccessThreshold; }

    public int getConsumerPrefetchCount() { return consumerPrefetchCount; }
    public void setConsumerPrefetchCount(int consumerPrefetchCount) { this.consumerPrefetchCount = consumerPrefetchCount; }
    public int getConsumerWorkerThreads() { return consumerWorkerThreads; }
    public void setConsumerWorkerThreads(int consumerWorkerThreads) { this.consumerWorkerThreads = consumerWorkerThreads; }
    public long getConsumerPollIntervalMs() { return consumerPollIntervalMs; }
    public void setConsumerPollIntervalMs(long consumerPollIntervalMs) { this.consumerPollIntervalMs = consumerPollIntervalMs; }

    public double getHealthQueueWarningFraction() { return healthQueueWarningFraction; }
    public void setHealthQueueWarningFraction(double healthQueueWarningFraction) { this.healthQueueWarningFraction = healthQueueWarningFraction; }
    public double getHealthErrorRateThreshold() { return healthErrorRateThreshold; }
    public void setHealthErrorRateThreshold(double healthErrorRateThreshold) { this.healthErrorRateThreshold = healthErrorRateThreshold; }

    @Override
    public String toString() {
        return "MessagingConfig{host='" + host + "', port=" + port + ", vhost='" + virtualHost +
               "', prefetch=" + consumerPrefetchCount + ", retryAttempts=" + publishRetryMaxAttempts + "}";
    }

    // ─── Typed property access ──────────────────────────────────────

    private static final class Reader {
        private final PropertyResolver resolver;

        Reader(PropertyResolver resolver) { this.resolver = resolver; }

        String string(String key, String def) {
            String val = resolver.getResolved(key);
            return val == null || val.isBlank() ? def : val.trim();
        }

        int integer(String key, int def) {
            String val = string(key, null);
            if (val == null) return def;
            try { return Integer.parseInt(val); }
            catch (NumberFormatException e) { throw invalid(key, val); }
        }

        long longValue(String key, long def) {
            String val = string(key, null);
            if (val == null) return def;
            try { return Long.parseLong(val); }
            catch (NumberFormatException e) { throw invalid(key, val); }
        }

        /** Present but empty means "none", which is different from absent. */
        Long optionalLong(String key, Long def) {
            String raw = resolver.getResolved(key);
            if (raw == null) return def;
            if (raw.isBlank() || "none".equalsIgnoreCase(raw.trim())) return null;
            try { return Long.parseLong(raw.trim()); }
            catch (NumberFormatException e) { throw invalid(key, raw); }
        }

        double decimal(String key, double def) {
            String val = string(key, null);
            if (val == null) return def;
            try { return Double.parseDouble(val); }
            catch (NumberFormatException e) { throw invalid(key, val); }
        }

        boolean bool(String key, boolean def) {
            String val = string(key, null);
            return val == null ? def : "true".equalsIgnoreCase(val);
        }

        private ConfigResolutionException invalid(String key, String val) {
            return new ConfigResolutionException("Invalid value for " + key + ": '" + val + "'");
        }
    }
}
