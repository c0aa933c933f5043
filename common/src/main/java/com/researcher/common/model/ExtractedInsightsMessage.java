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
import java.util.Map;
import java.util.Objects;

/**
 * Insights extracted from a deduplicated item. Published to {@code insights.extracted}.
 *
 * <p>Carries two lineage references: the discovered message and the deduplicated message.
 * They must differ from each other and from this message's own id.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractedInsightsMessage extends BaseMessage {

    @JsonProperty("source_type")
    private final SourceType sourceType;

    @JsonProperty("source_url")
    private final String sourceUrl;

    @JsonProperty("source_title")
    private final String sourceTitle;

    @JsonProperty("key_insights")
    private final String keyInsights;

    @JsonProperty("core_techniques")
    private final List<String> coreTechniques;

    @JsonProperty("code_snippets")
    private final List<String> codeSnippets;

    @JsonProperty("actionability_score")
    private final double actionabilityScore;

    @JsonProperty("metadata")
    private final Map<String, Object> metadata;

    @JsonProperty("original_correlation_id")
    private final String originalCorrelationId;

    @JsonProperty("deduplicated_correlation_id")
    private final String deduplicatedCorrelationId;

    @JsonCreator
    public ExtractedInsightsMessage(@JsonProperty("correlation_id") String correlationId,
                                    @JsonProperty("created_at") Instant createdAt,
                                    @JsonProperty("retry_count") Integer retryCount,
                                    @JsonProperty("source_type") SourceType sourceType,
                                    @JsonProperty("source_url") String sourceUrl,
                                    @JsonProperty("source_title") String sourceTitle,
                                    @JsonProperty("key_insights") String keyInsights,
                                    @JsonProperty("core_techniques") List<String> coreTechniques,
                                    @JsonProperty("code_snippets") List<String> codeSnippets,
                                    @JsonProperty("actionability_score") Double actionabilityScore,
                                    @JsonProperty("metadata") Map<String, Object> metadata,
                                    @JsonProperty("original_correlation_id") String originalCorrelationId,
                                    @JsonProperty("deduplicated_correlation_id") String deduplicatedCorrelationId) {
        super(correlationId, createdAt, retryCount);
        this.sourceType = Validation.required("source_type", sourceType);
        this.sourceUrl = Validation.nonBlank("source_url", sourceUrl, SourceMessage.MAX_URL);
        this.sourceTitle = Validation.nonBlank("source_title", sourceTitle, SourceMessage.MAX_TITLE);
        this.keyInsights = Validation.nonBlank("key_insights", keyInsights);
        this.coreTechniques = Validation.stringList("core_techniques", coreTechniques);
        this.codeSnippets = Validation.stringList("code_snippets", codeSnippets);
        this.actionabilityScore = Validation.unitInterval("actionability_score", actionabilityScore);
        this.metadata = Validation.metadata(metadata);
        this.originalCorrelationId = Validation.lineage("original_correlation_id",
                originalCorrelationId, getCorrelationId());
        this.deduplicatedCorrelationId = Validation.lineage("deduplicated_correlation_id",
                deduplicatedCorrelationId, getCorrelationId());
        if (this.originalCorrelationId.equals(this.deduplicatedCorrelationId)) {
            throw new MessageValidationException("deduplicated_correlation_id",
                    "must differ from original_correlation_id");
        }
    }

    public SourceType getSourceType() { return sourceType; }
    public String getSourceUrl() { return sourceUrl; }
    public String getSourceTitle() { return sourceTitle; }
    public String getKeyInsights() { return keyInsights; }
    public List<String> getCoreTechniques() { return coreTechniques; }
    public List<String> getCodeSnippets() { return codeSnippets; }
    public double getActionabilityScore() { return actionabilityScore; }
    public Map<String, Object> getMetadata() { return metadata; }
    public String getOriginalCorrelationId() { return originalCorrelationId; }
    public String getDeduplicatedCorrelationId() { return deduplicatedCorrelationId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedInsightsMessage that)) return false;
        return envelopeEquals(that)
                && Double.compare(actionabilityScore, that.actionabilityScore) == 0
                && sourceType == that.sourceType
                && sourceUrl.equals(that.sourceUrl)
                && sourceTitle.equals(that.sourceTitle)
                && keyInsights.equals(that.keyInsights)
                && coreTechniques.equals(that.coreTechniques)
                && codeSnippets.equals(that.codeSnippets)
                && metadata.equals(that.metadata)
                && originalCorrelationId.equals(that.originalCorrelationId)
                && deduplicatedCorrelationId.equals(that.deduplicatedCorrelationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(envelopeHash(), sourceType, sourceUrl, sourceTitle, keyInsights, coreTechniques,
                codeSnippets, actionabilityScore, metadata, originalCorrelationId, deduplicatedCorrelationId);
    }
}
