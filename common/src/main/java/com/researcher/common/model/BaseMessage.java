/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.researcher.common.exception.MessageValidationException;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope fields shared by every pipeline message.
 *
 * <h3>Semantics</h3>
 * <ul>
 *   <li>{@code correlation_id}: trace token, a fresh UUID when absent</li>
 *   <li>{@code created_at}: UTC instant, set at construction</li>
 *   <li>{@code retry_count}: informational only; retry state lives in the publisher</li>
 * </ul>
 *
 * <p>Instances are immutable. Subclasses validate their own fields in the constructor and
 * throw {@link MessageValidationException} so an invalid message can never be observed.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class BaseMessage {

    @JsonProperty("correlation_id")
    private final String correlationId;

    @JsonProperty("created_at")
    private final Instant createdAt;

    @JsonProperty("retry_count")
    private final int retryCount;

    protected BaseMessage(String correlationId, Instant createdAt, Integer retryCount) {
        if (correlationId != null && correlationId.isBlank()) {
            throw new MessageValidationException("correlation_id", "cannot be blank");
        }
        if (retryCount != null && retryCount < 0) {
            throw new MessageValidationException("retry_count", "cannot be negative");
        }
        this.correlationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.retryCount = retryCount != null ? retryCount : 0;
    }

    public String getCorrelationId() { return correlationId; }
    public Instant getCreatedAt() { return createdAt; }
    public int getRetryCount() { return retryCount; }

    protected boolean envelopeEquals(BaseMessage other) {
        return retryCount == other.retryCount
                && correlationId.equals(other.correlationId)
                && createdAt.equals(other.createdAt);
    }

    protected int envelopeHash() {
        return Objects.hash(correlationId, createdAt, retryCount);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{correlationId=" + correlationId
                + ", createdAt=" + createdAt + ", retryCount=" + retryCount + "}";
    }
}
