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
 * Raw content found by a fetcher. Published to {@code content.discovered}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourceMessage extends BaseMessage {

    static final int MAX_URL = 2048;
    static final int MAX_TITLE = 512;

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

    public SourceMessage(SourceType sourceType, String url, String title, String content,
                         Map<String, Object> metadata) {
        this(null, null, null, sourceType, url, title, content, metadata);
    }

    @JsonCreator
    public SourceMessage(@JsonProperty("correlation_id") String correlationId,
                         @JsonProperty("created_at") Instant createdAt,
                         @JsonProperty("retry_count") Integer retryCount,
                         @JsonProperty("source_type") SourceType sourceType,
                         @JsonProperty("url") String url,
                         @JsonProperty("title") String title,
                         @JsonProperty("content") String content,
                         @JsonProperty("metadata") Map<String, Object> metadata) {
        super(correlationId, createdAt, retryCount);
        this.sourceType = Validation.required("source_type", sourceType);
        this.url = Validation.nonBlank("url", url, MAX_URL);
        this.title = Validation.nonBlank("title", title, MAX_TITLE);
        this.content = Validation.nonBlank("content", content);
        this.metadata = Validation.metadata(metadata);
    }

    public SourceType getSourceType() { return sourceType; }
    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceMessage that)) return false;
        return envelopeEquals(that) && sourceType == that.sourceType && url.equals(that.url)
                && title.equals(that.title) && content.equals(that.content) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(envelopeHash(), sourceType, url, title, content, metadata);
    }
}
