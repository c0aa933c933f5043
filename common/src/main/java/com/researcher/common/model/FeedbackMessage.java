/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.researcher.common.util.Validation;

import java.time.Instant;
import java.util.Objects;

/**
 * A user's rating of one digest item. Published to {@code feedback.submitted}, which never
 * expires messages.
 *
 * <p>The rated item's digest is referenced through {@code digest_correlation_id}; the
 * envelope's own {@code correlation_id} stays a fresh trace token.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedbackMessage extends BaseMessage {

    @JsonProperty("item_id")
    private final String itemId;

    @JsonProperty("digest_correlation_id")
    private final String digestCorrelationId;

    @JsonProperty("rating")
    private final int rating;

    @JsonProperty("implemented")
    private final boolean implemented;

    @JsonProperty("notes")
    private final String notes;

    @JsonProperty("category")
    private final String category;

    @JsonProperty("source_type")
    private final SourceType sourceType;

    public FeedbackMessage(String itemId, String digestCorrelationId, int rating, boolean implemented) {
        this(null, null, null, itemId, digestCorrelationId, rating, implemented, null, null, null);
    }

    @JsonCreator
    public FeedbackMessage(@JsonProperty("correlation_id") String correlationId,
                           @JsonProperty("created_at") Instant createdAt,
                           @JsonProperty("retry_count") Integer retryCount,
                           @JsonProperty("item_id") String itemId,
                           @JsonProperty("digest_correlation_id") String digestCorrelationId,
                           @JsonProperty("rating") Integer rating,
                           @JsonProperty("implemented") Boolean implemented,
                           @JsonProperty("notes") String notes,
                           @JsonProperty("category") String category,
                           @JsonProperty("source_type") SourceType sourceType) {
        super(correlationId, createdAt, retryCount);
        this.itemId = Validation.nonBlank("item_id", itemId);
        this.digestCorrelationId = digestCorrelationId == null ? null
                : Validation.lineage("digest_correlation_id", digestCorrelationId, getCorrelationId());
        this.rating = Validation.inRange("rating", rating, 1, 5);
        this.implemented = Validation.required("implemented", implemented);
        this.notes = notes;
        this.category = category;
        this.sourceType = sourceType;
    }

    public String getItemId() { return itemId; }
    public String getDigestCorrelationId() { return digestCorrelationId; }
    public int getRating() { return rating; }
    public boolean isImplemented() { return implemented; }
    public String getNotes() { return notes; }
    public String getCategory() { return category; }
    public SourceType getSourceType() { return sourceType; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeedbackMessage that)) return false;
        return envelopeEquals(that) && rating == that.rating && implemented == that.implemented
                && itemId.equals(that.itemId) && Objects.equals(digestCorrelationId, that.digestCorrelationId)
                && Objects.equals(notes, that.notes) && Objects.equals(category, that.category)
                && sourceType == that.sourceType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(envelopeHash(), itemId, digestCorrelationId, rating, implemented, notes, category,
                sourceType);
    }
}
