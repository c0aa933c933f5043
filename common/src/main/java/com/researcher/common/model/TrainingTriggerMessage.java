/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.researcher.common.exception.MessageValidationException;
import com.researcher.common.util.Validation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Request to retrain the relevance model. Published to {@code training.trigger}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrainingTriggerMessage extends BaseMessage {

    /** threshold_reached, manual or scheduled; free text on the wire. */
    @JsonProperty("trigger_reason")
    private final String triggerReason;

    @JsonProperty("feedback_count")
    private final int feedbackCount;

    @JsonProperty("model_version")
    private final String modelVersion;

    @JsonProperty("triggered_at")
    private final Instant triggeredAt;

    @JsonProperty("feedback_correlation_ids")
    private final List<String> feedbackCorrelationIds;

    public TrainingTriggerMessage(String triggerReason, int feedbackCount, List<String> feedbackCorrelationIds) {
        this(null, null, null, triggerReason, feedbackCount, null, null, feedbackCorrelationIds);
    }

    @JsonCreator
    public TrainingTriggerMessage(@JsonProperty("correlation_id") String correlationId,
                                  @JsonProperty("created_at") Instant createdAt,
                                  @JsonProperty("retry_count") Integer retryCount,
                                  @JsonProperty("trigger_reason") String triggerReason,
                                  @JsonProperty("feedback_count") Integer feedbackCount,
                                  @JsonProperty("model_version") String modelVersion,
                                  @JsonProperty("triggered_at") Instant triggeredAt,
                                  @JsonProperty("feedback_correlation_ids") List<String> feedbackCorrelationIds) {
        super(correlationId, createdAt, retryCount);
        this.triggerReason = Validation.nonBlank("trigger_reason", triggerReason);
        this.feedbackCount = Validation.inRange("feedback_count", feedbackCount, 0, Integer.MAX_VALUE);
        this.modelVersion = modelVersion;
        this.triggeredAt = triggeredAt != null ? triggeredAt : Instant.now();
        this.feedbackCorrelationIds = Validation.stringList("feedback_correlation_ids", feedbackCorrelationIds);
        if (this.feedbackCorrelationIds.contains(getCorrelationId())) {
            throw new MessageValidationException("feedback_correlation_ids",
                    "cannot reference the message's own correlation_id");
        }
    }

    public String getTriggerReason() { return triggerReason; }
    public int getFeedbackCount() { return feedbackCount; }
    public String getModelVersion() { return modelVersion; }
    public Instant getTriggeredAt() { return triggeredAt; }
    public List<String> getFeedbackCorrelationIds() { return feedbackCorrelationIds; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrainingTriggerMessage that)) return false;
        return envelopeEquals(that) && feedbackCount == that.feedbackCount
                && triggerReason.equals(that.triggerReason) && Objects.equals(modelVersion, that.modelVersion)
                && triggeredAt.equals(that.triggeredAt) && feedbackCorrelationIds.equals(that.feedbackCorrelationIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(envelopeHash(), triggerReason, feedbackCount, modelVersion, triggeredAt,
                feedbackCorrelationIds);
    }
}
