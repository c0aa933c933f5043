/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.util;

import com.researcher.common.exception.MessageValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fail-fast field checks used by message constructors.
 */
public final class Validation {

    private Validation() {}

    public static <T> T required(String field, T value) {
        if (value == null) {
            throw new MessageValidationException(field, "is required");
        }
        return value;
    }

    public static String nonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new MessageValidationException(field, "cannot be empty");
        }
        return value;
    }

    public static String nonBlank(String field, String value, int maxLength) {
        nonBlank(field, value);
        return maxLength(field, value, maxLength);
    }

    public static String maxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new MessageValidationException(field, "exceeds " + maxLength + " characters");
        }
        return value;
    }

    public static double unitInterval(String field, Double value) {
        required(field, value);
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new MessageValidationException(field, "must be between 0.0 and 1.0, got " + value);
        }
        return value;
    }

    public static int inRange(String field, Integer value, int min, int max) {
        required(field, value);
        if (value < min || value > max) {
            throw new MessageValidationException(field, "must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    /** Immutable copy; {@code null} becomes an empty list, blank entries are rejected. */
    public static List<String> stringList(String field, List<String> values) {
        if (values == null) return Collections.emptyList();
        List<String> copy = new ArrayList<>(values.size());
        for (String v : values) {
            nonBlank(field, v);
            copy.add(v);
        }
        return Collections.unmodifiableList(copy);
    }

    /** Immutable copy preserving insertion order; null values are allowed in metadata. */
    public static Map<String, Object> metadata(Map<String, Object> values) {
        if (values == null) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Lineage must point at an earlier message, never at the message itself. */
    public static String lineage(String field, String referencedId, String ownId) {
        nonBlank(field, referencedId);
        if (referencedId.equals(ownId)) {
            throw new MessageValidationException(field, "cannot reference the message's own correlation_id");
        }
        return referencedId;
    }
}
