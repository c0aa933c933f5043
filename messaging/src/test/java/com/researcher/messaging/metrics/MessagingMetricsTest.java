/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MessagingMetricsTest {

    private SimpleMeterRegistry registry;
    private MessagingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MessagingMetrics(registry);
    }

    @Test
    void countersIncrementAndDecrement() {
        metrics.increment("jobs");
        metrics.increment("jobs", 4);
        metrics.decrement("jobs");

        assertThat(metrics.getCounter("jobs")).isEqualTo(4);
        assertThat(metrics.getCounter("never.touched")).isZero();
    }

    @Test
    void convenienceRecordersUseQueueScopedNames() {
        metrics.recordMessagePublished("content.discovered");
        metrics.recordMessageConsumed("content.discovered");
        metrics.recordMessageAcked("content.discovered");
        metrics.recordMessageNacked("content.discovered", true);
        metrics.recordMessageNacked("content.discovered", false);
        metrics.recordDlqMessage("content.discovered", "permanent_error");

        assertThat(metrics.getCounter("messages.published.content.discovered")).isEqualTo(1);
        assertThat(metrics.getCounter("messages.consumed.content.discovered")).isEqualTo(1);
        assertThat(metrics.getCounter("messages.acked.content.discovered")).isEqualTo(1);
        assertThat(metrics.getCounter("messages.nacked.content.discovered.requeued")).isEqualTo(1);
        assertThat(metrics.getCounter("messages.nacked.content.discovered.dlq")).isEqualTo(1);
        assertThat(metrics.getCounter("dlq.messages.content.discovered")).isEqualTo(1);
        assertThat(metrics.getCounter("dlq.content.discovered.permanent_error")).isEqualTo(1);
    }

    @Test
    void gaugesHoldLastValue() {
        assertThat(metrics.getGauge("depth")).isNull();
        metrics.setGauge("depth", 3);
        metrics.setGauge("depth", 7.5);

        assertThat(metrics.getGauge("depth")).isEqualTo(7.5);
    }

    @Test
    void timerStatsUseInterpolatedPercentiles() {
        for (int i = 1; i <= 100; i++) {
            metrics.recordTime("handler.dedup", i);
        }

        TimerStats stats = metrics.getTimerStats("handler.dedup");

        assertThat(stats.count()).isEqualTo(100);
        assertThat(stats.min()).isEqualTo(1.0);
        assertThat(stats.max()).isEqualTo(100.0);
        assertThat(stats.avg()).isCloseTo(50.5, within(1e-9));
        assertThat(stats.p50()).isCloseTo(50.5, within(1e-9));
        assertThat(stats.p95()).isCloseTo(95.05, within(1e-9));
        assertThat(stats.p99()).isCloseTo(99.01, within(1e-9));
    }

    @Test
    void timerWindowKeepsMostRecentSamples() {
        for (int i = 0; i < MessagingMetrics.TIMER_WINDOW + 250; i++) {
            metrics.recordTime("t", i);
        }

        TimerStats stats = metrics.getTimerStats("t");
        assertThat(stats.count()).isEqualTo(MessagingMetrics.TIMER_WINDOW);
        assertThat(stats.min()).isEqualTo(250.0);
    }

    @Test
    void emptyTimerReportsZeros() {
        assertThat(metrics.getTimerStats("unknown")).isEqualTo(TimerStats.EMPTY);
    }

    @Test
    void errorsAreTalliedPerQueueAndType() {
        metrics.recordError("content.discovered", "IOException");
        metrics.recordError("content.discovered", "IOException");
        metrics.recordError("digest.ready", "TimeoutException");

        assertThat(metrics.getErrorSummary("content.discovered")).containsExactly(Map.entry("IOException", 2L));
        assertThat(metrics.getErrorSummary()).containsOnlyKeys("content.discovered", "digest.ready");
        assertThat(metrics.getCounter("total_errors.content.discovered")).isEqualTo(2);
        assertThat(metrics.getTotalErrors()).isEqualTo(3);
    }

    @Test
    void totalPublishedSumsEveryQueue() {
        metrics.recordMessagePublished("content.discovered");
        metrics.recordMessagePublished("digest.ready");
        metrics.recordMessagePublished("digest.ready");

        assertThat(metrics.getTotalPublished()).isEqualTo(3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void summaryContainsEverySection() {
        metrics.increment("c");
        metrics.setGauge("g", 1);
        metrics.recordTime("t", 5);
        metrics.recordError("q", "E");

        Map<String, Object> summary = metrics.getSummary();

        assertThat(summary).containsKeys("counters", "gauges", "timers", "errors", "timestamp");
        assertThat((Map<String, Long>) summary.get("counters")).containsEntry("c", 1L);
        assertThat((Map<String, Map<String, Object>>) summary.get("timers")).containsKey("t");
    }

    @Test
    void resetClearsEverythingOrOneName() {
        metrics.increment("a");
        metrics.increment("b");
        metrics.recordTime("t", 1);
        metrics.recordError("q", "E");

        metrics.reset("a");
        assertThat(metrics.getCounter("a")).isZero();
        assertThat(metrics.getCounter("b")).isEqualTo(1);

        metrics.reset();
        assertThat(metrics.getCounter("b")).isZero();
        assertThat(metrics.getTimerStats("t").count()).isZero();
        assertThat(metrics.getErrorSummary()).isEmpty();
    }

    @Test
    void metricsAreMirroredIntoMeterRegistry() {
        metrics.recordMessagePublished("content.discovered");
        metrics.recordError("content.discovered", "IOException");
        metrics.recordTime("consumed.content.discovered", 12);

        assertThat(registry.get("researcher.messaging.messages.published.content.discovered")
                .functionCounter().count()).isEqualTo(1.0);
        assertThat(registry.get("researcher.messaging.errors")
                .tag("queue", "content.discovered").tag("error_type", "IOException")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("researcher.messaging.consumed.content.discovered").timer().count()).isEqualTo(1);
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < 1000; i++) metrics.increment("shared");
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) f.get();
        pool.shutdown();

        assertThat(metrics.getCounter("shared")).isEqualTo(8000);
    }

    @Test
    void sharedInstanceIsCreatedOnceUnderConcurrentFirstUse() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<MessagingMetrics>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return MessagingMetrics.shared();
                }));
            }
            go.countDown();

            MessagingMetrics first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<MessagingMetrics> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
            assertThat(MessagingMetrics.shared()).isSameAs(first);
        } finally {
            pool.shutdownNow();
        }
    }
}
