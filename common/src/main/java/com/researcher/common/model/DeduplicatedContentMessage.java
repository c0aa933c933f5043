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
import java.util.Map;
import java.util.Objects;

/**
 * Content that passed the duplicate check. Published to {@code content.deduplicated}.
 * {@code original_correlation_id} points back at the {@link SourceMessage} it came from.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeduplicatedContentMessage extends BaseMessage {

    @JsonProperty("source_type")
    private final SourceType sourceType;

    @JsonProperty("url")
    private final String url;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("content")
    private final String content;

    @JsonProperty("metadata")
    private final Map<String, Object> metadata;

    @JsonProperty("original_correlation_id")
    private final String originalCorrelationId;

    /** Derive from a discovered message, keeping its content and linking back to it. */
    public static DeduplicatedContentMessage from(SourceMessage source) {
        return new DeduplicatedContentMessage(null, null, null, source.getSourceType(), source.getUrl(),
                source.getTitle(), source.getContent(), source.getMetadata(), source.getCorrelationId());
    }

    @JsonCreator
    public DeduplicatedContentMessage(@JsonProperty("correlation_id") String correlationId,
                                      @JsonProperty("created_at") Instant createdAt,
                                      @JsonProperty("retry_count") Integer retryCount,
                                      @JsonProperty("source_type") SourceType sourceType,
                                      @JsonProperty("url") String url,
                                      @JsonProperty("title") String title,
                                      @JsonProperty("content") String content,
                                      @JsonProperty("metadata") Map<String, Object> metadata,
                                      @JsonProperty("original_correlation_id") String originalCorrelationId) {
        super(correlationId, createdAt, retryCount);
        this.sourceType = Validation.required("source_type", sourceType);
        this.url = Validation.nonBlank("url", url, SourceMessage.MAX_URL);
        this.title = Validation.nonBlank("title", title, SourceMessage.MAX_TITLE);
        this.content = Validation.nonBlank("content", content);
        this.metadata = Validation.metadata(metadata);
        this.originalCorrelationId = Validation.lineage("original_correlation_id",
                originalCorrelationId, getCorrelationId());
    }

    public SourceType getSourceType() { return sourceType; }
    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public Map<String, Object> getMetadata() { return metadata; }
    public String getOriginalCorrelationId() { return originalCorrelationId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeduplicatedContentMessage that)) return false;
        return envelopeEquals(that) && sourceType == that.sourceType && url.equals(that.url)
                && title.equals(that.title) && content.equals(that.content)
                && metadata.equals(that.metadata) && originalCorrelationId.equals(that.originalCorrelationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(envelopeHash(), sourceType, url, title, content, metadata, originalCorrelationId);
    }
}
