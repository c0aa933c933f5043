/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.topology;

import com.researcher.common.config.MessagingConfig;
import com.researcher.common.model.QueueName;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Declared bounds of one main queue. {@code ttlMs} is {@code null} when messages never expire.
 */
public record QueueSpec(QueueName queue, int maxLength, Long ttlMs) {

    /**
     * Bounds for every main queue. Most queues use the configured max length and TTL;
     * insights, digest and training are capped tighter and feedback never expires.
     */
    public static List<QueueSpec> forConfig(MessagingConfig config) {
        int defaultMax = config.getQueueMaxLength();
        Long ttl = config.getQueueMessageTtlMs();
        return QueueName.mainQueues().stream()
                .map(q -> switch (q) {
                    case INSIGHTS_EXTRACTED -> new QueueSpec(q, 5000, ttl);
                    case DIGEST_READY -> new QueueSpec(q, 100, ttl);
                    case TRAINING_TRIGGER -> new QueueSpec(q, 10, ttl);
                    case FEEDBACK_SUBMITTED -> new QueueSpec(q, defaultMax, null);
                    default -> new QueueSpec(q, defaultMax, ttl);
                })
                .collect(Collectors.toList());
    }

    /** Broker arguments: dead-lettering to the companion DLQ, TTL and drop-oldest length bound. */
    public Map<String, Object> arguments() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("x-dead-letter-exchange", QueueSetup.DLQ_EXCHANGE);
        args.put("x-dead-letter-routing-key", queue.deadLetterQueue().value());
        if (ttlMs != null) {
            args.put("x-message-ttl", ttlMs);
        }
        if (maxLength > 0) {
            args.put("x-max-length", maxLength);
            args.put("x-overflow", "drop-head");
        }
        return args;
    }
}
