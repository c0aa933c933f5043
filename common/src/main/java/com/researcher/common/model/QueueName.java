/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Closed set of logical queues. Every main queue {@code <domain>.<event>} has exactly one
 * companion dead-letter queue {@code <domain>.<event>.dlq}; the routing key of a main queue
 * is its name.
 */
public enum QueueName {

    // Main pipeline queues
    CONTENT_DISCOVERED("content.discovered"),
    CONTENT_DEDUPLICATED("content.deduplicated"),
    INSIGHTS_EXTRACTED("insights.extracted"),
    DIGEST_READY("digest.ready"),

    // Feedback loop queues
    FEEDBACK_SUBMITTED("feedback.submitted"),
    TRAINING_TRIGGER("training.trigger"),

    // Dead letter queues
    CONTENT_DISCOVERED_DLQ("content.discovered.dlq"),
    CONTENT_DEDUPLICATED_DLQ("content.deduplicated.dlq"),
    INSIGHTS_EXTRACTED_DLQ("insights.extracted.dlq"),
    DIGEST_READY_DLQ("digest.ready.dlq"),
    FEEDBACK_SUBMITTED_DLQ("feedback.submitted.dlq"),
    TRAINING_TRIGGER_DLQ("training.trigger.dlq");

    private static final String DLQ_SUFFIX = ".dlq";

    private final String value;

    QueueName(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }

    public boolean isDeadLetter() { return value.endsWith(DLQ_SUFFIX); }

    /**
     * The companion DLQ of a main queue.
     *
     * @throws IllegalStateException when called on a DLQ
     */
    public QueueName deadLetterQueue() {
        if (isDeadLetter()) {
            throw new IllegalStateException(value + " is already a dead-letter queue");
        }
        return fromValue(value + DLQ_SUFFIX);
    }

    /** The main queue a DLQ belongs to; a main queue returns itself. */
    public QueueName mainQueue() {
        return isDeadLetter() ? fromValue(value.substring(0, value.length() - DLQ_SUFFIX.length())) : this;
    }

    public static List<QueueName> mainQueues() {
        return Arrays.stream(values()).filter(q -> !q.isDeadLetter()).collect(Collectors.toList());
    }

    public static List<QueueName> deadLetterQueues() {
        return Arrays.stream(values()).filter(QueueName::isDeadLetter).collect(Collectors.toList());
    }

    @JsonCreator
    public static QueueName fromValue(String value) {
        for (QueueName q : values()) {
            if (q.value.equals(value)) return q;
        }
        throw new IllegalArgumentException("Unknown queue: " + value);
    }

    @Override
    public String toString() { return value; }
}
