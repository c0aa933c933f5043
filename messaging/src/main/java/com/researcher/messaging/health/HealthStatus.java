/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.researcher.common.util.JsonUtil;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a messaging health check. Status only ever worsens while checks run.
 */
public class HealthStatus {

    public enum Status {
        HEALTHY, DEGRADED, UNHEALTHY;

        @JsonValue
        public String value() { return name().toLowerCase(); }

        Status worst(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    @JsonProperty("status")
    private Status status = Status.HEALTHY;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("checks")
    private final Map<String, String> checks = new LinkedHashMap<>();

    @JsonProperty("metrics")
    private final Map<String, Object> metrics = new LinkedHashMap<>();

    public HealthStatus(Instant timestamp) {
        this.timestamp = timestamp;
    }

    void degrade(Status to) { status = status.worst(to); }

    void check(String name, String result) { checks.put(name, result); }

    void metric(String name, Object value) { metrics.put(name, value); }

    public Status getStatus() { return status; }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, String> getChecks() { return Collections.unmodifiableMap(checks); }
    public Map<String, Object> getMetrics() { return Collections.unmodifiableMap(metrics); }

    public boolean isHealthy() { return status == Status.HEALTHY; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.value());
        map.put("timestamp", timestamp.toString());
        map.put("checks", new LinkedHashMap<>(checks));
        map.put("metrics", new LinkedHashMap<>(metrics));
        return map;
    }

    /** The {@link #toMap()} payload as JSON, for an outer status endpoint. */
    public String toJson() {
        return JsonUtil.toJson(toMap());
    }

    @Override
    public String toString() {
        return "HealthStatus{status=" + status.value() + ", checks=" + checks.size() + ", timestamp=" + timestamp + "}";
    }
}
