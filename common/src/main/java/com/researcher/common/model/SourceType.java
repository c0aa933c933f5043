/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Content source a discovered item came from.
 */
public enum SourceType {
    ARXIV("arxiv"),
    KAGGLE("kaggle"),
    HUGGINGFACE("huggingface"),
    WEB_SEARCH("web_search");

    private final String value;

    SourceType(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }

    @JsonCreator
    public static SourceType fromValue(String value) {
        for (SourceType t : values()) {
            if (t.value.equals(value)) return t;
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
