/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Centralized Jackson ObjectMapper for the wire format. Thread-safe singleton.
 *
 * <p>Wire format: compact UTF-8 JSON, timestamps as ISO-8601 strings,
 * enumerations as their string value.</p>
 */
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);

    private JsonUtil() {}

    /** Serialize to wire bytes. Failures surface so callers can classify them. */
    public static byte[] toBytes(Object obj) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(obj);
    }

    /**
     * Deserialize wire bytes into a fresh instance of {@code clazz}.
     * Schema violations raised by constructors arrive wrapped in a Jackson exception.
     */
    public static <T> T fromBytes(byte[] body, Class<T> clazz) throws IOException {
        return MAPPER.readValue(body, clazz);
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
