/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static queue to schema mapping. Each main queue carries exactly one message type;
 * dead-letter queues carry whatever was rejected and have no schema.
 */
public final class MessageSchemas {

    private static final Map<QueueName, Class<? extends BaseMessage>> SCHEMAS;

    static {
        Map<QueueName, Class<? extends BaseMessage>> m = new EnumMap<>(QueueName.class);
        m.put(QueueName.CONTENT_DISCOVERED, SourceMessage.class);
        m.put(QueueName.CONTENT_DEDUPLICATED, DeduplicatedContentMessage.class);
        m.put(QueueName.INSIGHTS_EXTRACTED, ExtractedInsightsMessage.class);
        m.put(QueueName.DIGEST_READY, DigestReadyMessage.class);
        m.put(QueueName.FEEDBACK_SUBMITTED, FeedbackMessage.class);
        m.put(QueueName.TRAINING_TRIGGER, TrainingTriggerMessage.class);
        SCHEMAS = Collections.unmodifiableMap(m);
    }

    private MessageSchemas() {}

    public static Optional<Class<? extends BaseMessage>> schemaFor(QueueName queue) {
        return Optional.ofNullable(SCHEMAS.get(queue));
    }

    public static Map<QueueName, Class<? extends BaseMessage>> all() { return SCHEMAS; }
}
