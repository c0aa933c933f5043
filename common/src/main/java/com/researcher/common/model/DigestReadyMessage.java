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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A synthesized batch ready for rendering. Published to {@code digest.ready}.
 * {@code item_count} must equal the number of {@code digest_items}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DigestReadyMessage extends BaseMessage {

    @JsonProperty("digest_items")
    private final List<DigestItem> digestItems;

    @JsonProperty("item_count")
    private final int itemCount;

    @JsonProperty("generated_at")
    private final Instant generatedAt;

    @JsonProperty("categories")
    private final List<String> categories;

    @JsonProperty("insight_correlation_ids")
    private final List<String> insightCorrelationIds;

    public DigestReadyMessage(List<DigestItem> digestItems, List<String> categories,
                              List<String> insightCorrelationIds) {
        this(null, null, null, digestItems, digestItems == null ? null : digestItems.size(),
                null, categories, insightCorrelationIds);
    }

    @JsonCreator
    public DigestReadyMessage(@JsonProperty("correlation_id") String correlationId,
                              @JsonProperty("created_at") Instant createdAt,
                              @JsonProperty("retry_count") Integer retryCount,
                              @JsonProperty("digest_items") List<DigestItem> digestItems,
                              @JsonProperty("item_count") Integer itemCount,
                              @JsonProperty("generated_at") Instant generatedAt,
                              @JsonProperty("categories") List<String> categories,
                              @JsonProperty("insight_correlation_ids") List<String> insightCorrelationIds) {
        super(correlationId, createdAt, retryCount);
        if (digestItems == null || digestItems.isEmpty()) {
            throw new MessageValidationException("digest_items", "requires at least one item");
        }
        if (digestItems.contains(null)) {
            throw new MessageValidationException("digest_items", "cannot contain null items");
        }
        Validation.required("item_count", itemCount);
        if (itemCount != digestItems.size()) {
            throw new MessageValidationException("item_count",
                    "must match digest_items length (" + itemCount + " != " + digestItems.size() + ")");
        }
        this.digestItems = Collections.unmodifiableList(new ArrayList<>(digestItems));
        this.itemCount = itemCount;
        this.generatedAt = generatedAt != null ? generatedAt : Instant.now();
        this.categories = Validation.stringList("categories", categories);
        this.insightCorrelationIds = Validation.stringList("insight_correlation_ids", insightCorrelationIds);
        if (this.insightCorrelationIds.contains(getCorrelationId())) {
            throw new MessageValidationException("insight_correlation_ids",
                    "cannot reference the message's own correlation_id");
        }
    }

    public List<DigestItem> getDigestItems() { return digestItems; }
    public int getItemCount() { return itemCount; }
    public Instant getGeneratedAt() { return generatedAt; }
    public List<String> getCategories() { return categories; }
    public List<String> getInsightCorrelationIds() { return insightCorrelationIds; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DigestReadyMessage that)) return false;
        return envelopeEquals(that) && itemCount == that.itemCount && digestItems.equals(that.digestItems)
                && generatedAt.equals(that.generatedAt) && categories.equals(that.categories)
                && insightCorrelationIds.equals(that.insightCorrelationIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(envelopeHash(), digestItems, itemCount, generatedAt, categories, insightCorrelationIds);
    }
}
