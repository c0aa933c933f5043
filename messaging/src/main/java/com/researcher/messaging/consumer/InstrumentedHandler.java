/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.consumer;

import com.researcher.common.model.BaseMessage;
import com.researcher.messaging.metrics.MessagingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Handler wrapper that times every invocation under {@code handler.<name>} and records
 * failures by exception type under the same key. The delegate's outcome passes through
 * unchanged, so acknowledgement decisions are unaffected.
 *
 * <pre>{@code
 * consumer.subscribe(QueueName.CONTENT_DISCOVERED, SourceMessage.class,
 *         new InstrumentedHandler<>("dedup", metrics, dedupHandler));
 * }</pre>
 */
public class InstrumentedHandler<T extends BaseMessage> implements MessageHandler<T> {

    private static final Logger log = LoggerFactory.getLogger(InstrumentedHandler.class);

    private final String name;
    private final MessagingMetrics metrics;
    private final MessageHandler<T> delegate;

    public InstrumentedHandler(String name, MessagingMetrics metrics, MessageHandler<T> delegate) {
        this.name = name;
        this.metrics = metrics;
        this.delegate = delegate;
    }

    @Override
    public CompletionStage<Void> handle(T message) {
        long start = System.nanoTime();
        String metricName = "handler." + name;
        log.debug("{} handling {}", name, message.getCorrelationId());

        CompletionStage<Void> stage;
        try {
            stage = delegate.handle(message);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            stage = CompletableFuture.completedFuture(null);
        }
        return stage.whenComplete((v, error) -> {
            metrics.recordTime(metricName, (System.nanoTime() - start) / 1_000_000.0);
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                metrics.recordError(metricName, cause.getClass().getSimpleName());
                log.warn("{} failed on {}: {}", name, message.getCorrelationId(), cause.getMessage());
            } else {
                log.debug("{} finished {}", name, message.getCorrelationId());
            }
        });
    }

    public String getName() { return name; }
}
