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

import java.util.List;
import java.util.Objects;

/**
 * One synthesized entry of a digest. Not a message on its own: it has no envelope.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DigestItem {

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

    @JsonProperty("category")
    private final String category;

    @JsonProperty("application_ideas")
    private final List<String> applicationIdeas;

    /** Personalized relevance, absent until scored. */
    @JsonProperty("relevance_score")
    private final Double relevanceScore;

    @JsonCreator
    public DigestItem(@JsonProperty("source_type") SourceType sourceType,
                      @JsonProperty("source_url") String sourceUrl,
                      @JsonProperty("source_title") String sourceTitle,
                      @JsonProperty("key_insights") String keyInsights,
                      @JsonProperty("core_techniques") List<String> coreTechniques,
                      @JsonProperty("code_snippets") List<String> codeSnippets,
                      @JsonProperty("category") String category,
                      @JsonProperty("application_ideas") List<String> applicationIdeas,
                      @JsonProperty("relevance_score") Double relevanceScore) {
        this.sourceType = Validation.required("source_type", sourceType);
        this.sourceUrl = Validation.nonBlank("source_url", sourceUrl, SourceMessage.MAX_URL);
        this.sourceTitle = Validation.nonBlank("source_title", sourceTitle, SourceMessage.MAX_TITLE);
        this.keyInsights = Validation.nonBlank("key_insights", keyInsights);
        this.coreTechniques = Validation.stringList("core_techniques", coreTechniques);
        this.codeSnippets = Validation.stringList("code_snippets", codeSnippets);
        this.category = Validation.nonBlank("category", category, 100);
        this.applicationIdeas = Validation.stringList("application_ideas", applicationIdeas);
        if (this.applicationIdeas.isEmpty()) {
            throw new MessageValidationException("application_ideas", "requires at least one idea");
        }
        this.relevanceScore = relevanceScore == null ? null
                : Validation.unitInterval("relevance_score", relevanceScore);
    }

    public SourceType getSourceType() { return sourceType; }
    public String getSourceUrl() { return sourceUrl; }
    public String getSourceTitle() { return sourceTitle; }
    public String getKeyInsights() { return keyInsights; }
    public List<String> getCoreTechniques() { return coreTechniques; }
    public List<String> getCodeSnippets() { return codeSnippets; }
    public String getCategory() { return category; }
    public List<String> getApplicationIdeas() { return applicationIdeas; }
    public Double getRelevanceScore() { return relevanceScore; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DigestItem that)) return false;
        return sourceType == that.sourceType && sourceUrl.equals(that.sourceUrl)
                && sourceTitle.equals(that.sourceTitle) && keyInsights.equals(that.keyInsights)
                && coreTechniques.equals(that.coreTechniques) && codeSnippets.equals(that.codeSnippets)
                && category.equals(that.category) && applicationIdeas.equals(that.applicationIdeas)
                && Objects.equals(relevanceScore, that.relevanceScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceType, sourceUrl, sourceTitle, keyInsights, coreTechniques, codeSnippets,
                category, applicationIdeas, relevanceScore);
    }
}
