/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe counters, gauges, timers and error tallies for messaging operations.
 *
 * <p>Metric names are free-form dotted strings. The in-process store is authoritative for
 * {@link #getCounter}, {@link #getTimerStats} and the health checker; every metric is also
 * mirrored into a Micrometer {@link MeterRegistry} under the {@code researcher.messaging.}
 * prefix so an outer endpoint can export it.</p>
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Name</th><th>Type</th><th>Recorded by</th></tr>
 *   <tr><td>messages.published.&lt;queue&gt;</td><td>Counter</td><td>publisher, on confirmed send</td></tr>
 *   <tr><td>messages.consumed.&lt;queue&gt;</td><td>Counter</td><td>consumer, handler returned</td></tr>
 *   <tr><td>messages.acked.&lt;queue&gt;</td><td>Counter</td><td>consumer</td></tr>
 *   <tr><td>messages.nacked.&lt;queue&gt;.requeued|dlq</td><td>Counter</td><td>consumer</td></tr>
 *   <tr><td>dlq.messages.&lt;queue&gt;, dlq.&lt;queue&gt;.&lt;reason&gt;</td><td>Counter</td><td>consumer</td></tr>
 *   <tr><td>total_errors.&lt;queue&gt;</td><td>Counter</td><td>{@link #recordError}</td></tr>
 *   <tr><td>consumed.&lt;queue&gt;</td><td>Timer</td><td>consumer, processing time</td></tr>
 * </table>
 */
public class MessagingMetrics {

    private static final Logger log = LoggerFactory.getLogger(MessagingMetrics.class);

    public static final int TIMER_WINDOW = 1000;
    static final String PREFIX = "researcher.messaging.";

    private static final Object SHARED_LOCK = new Object();
    private static MessagingMetrics shared;

    private final MeterRegistry registry;
    private final Object lock = new Object();

    private final Map<String, AtomicLong> counters = new HashMap<>();
    private final Map<String, AtomicReference<Double>> gauges = new HashMap<>();
    private final Map<String, Deque<Double>> timers = new HashMap<>();
    private final Map<String, Map<String, Long>> errors = new HashMap<>();

    // Micrometer meters cached per name (avoid repeated registry lookups)
    private final Map<String, Timer> meterTimers = new HashMap<>();
    private final Map<String, Counter> meterErrors = new HashMap<>();

    public MessagingMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MessagingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Process-wide instance for callers that do not pass one explicitly.
     * Created on first use under a lock so concurrent first callers share one instance.
     */
    public static MessagingMetrics shared() {
        synchronized (SHARED_LOCK) {
            if (shared == null) {
                shared = new MessagingMetrics();
                log.debug("Shared messaging metrics instance created");
            }
            return shared;
        }
    }

    // ─── Primitives ─────────────────────────────────────────────────────

    public void increment(String name) { increment(name, 1); }

    public void increment(String name, long value) {
        synchronized (lock) {
            counter(name).addAndGet(value);
        }
    }

    public void decrement(String name) { decrement(name, 1); }

    public void decrement(String name, long value) {
        synchronized (lock) {
            counter(name).addAndGet(-value);
        }
    }

    public void setGauge(String name, double value) {
        synchronized (lock) {
            gauges.computeIfAbsent(name, n -> {
                AtomicReference<Double> ref = new AtomicReference<>();
                Gauge.builder(PREFIX + n, ref, r -> r.get() == null ? Double.NaN : r.get())
                        .register(registry);
                return ref;
            }).set(value);
        }
    }

    /** Record one duration sample; the window keeps the most recent {@value #TIMER_WINDOW}. */
    public void recordTime(String name, double durationMs) {
        synchronized (lock) {
            Deque<Double> window = timers.computeIfAbsent(name, n -> new ArrayDeque<>());
            window.addLast(durationMs);
            while (window.size() > TIMER_WINDOW) {
                window.removeFirst();
            }
            meterTimers.computeIfAbsent(name, n ->
                    Timer.builder(PREFIX + n)
                            .publishPercentiles(0.5, 0.95, 0.99)
                            .register(registry)
            ).record(Math.round(durationMs * 1_000_000), TimeUnit.NANOSECONDS);
        }
    }

    /** Tally an error of {@code errorType} on {@code queue} and bump {@code total_errors.<queue>}. */
    public void recordError(String queue, String errorType) {
        String type = errorType != null ? errorType : "unknown";
        synchronized (lock) {
            errors.computeIfAbsent(queue, q -> new HashMap<>()).merge(type, 1L, Long::sum);
            counter("total_errors." + queue).incrementAndGet();
            meterErrors.computeIfAbsent(queue + "|" + type, k ->
                    Counter.builder(PREFIX + "errors")
                            .description("Messaging errors by queue and type")
                            .tag("queue", queue)
                            .tag("error_type", type)
                            .register(registry)
            ).increment();
        }
    }

    // ─── Convenience recorders ──────────────────────────────────────────

    public void recordMessagePublished(String queue) { increment("messages.published." + queue); }

    public void recordMessageConsumed(String queue) { increment("messages.consumed." + queue); }

    public void recordMessageAcked(String queue) { increment("messages.acked." + queue); }

    public void recordMessageNacked(String queue, boolean requeued) {
        increment("messages.nacked." + queue + (requeued ? ".requeued" : ".dlq"));
    }

    public void recordDlqMessage(String queue, String reason) {
        increment("dlq.messages." + queue);
        increment("dlq." + queue + "." + reason);
    }

    // ─── Queries ────────────────────────────────────────────────────────

    public long getCounter(String name) {
        synchronized (lock) {
            AtomicLong c = counters.get(name);
            return c == null ? 0 : c.get();
        }
    }

    /** Current gauge value, or {@code null} when never set or reset. */
    public Double getGauge(String name) {
        synchronized (lock) {
            AtomicReference<Double> g = gauges.get(name);
            return g == null ? null : g.get();
        }
    }

    public TimerStats getTimerStats(String name) {
        synchronized (lock) {
            return stats(timers.get(name));
        }
    }

    /** Error counts by type for one queue. */
    public Map<String, Long> getErrorSummary(String queue) {
        synchronized (lock) {
            return new TreeMap<>(errors.getOrDefault(queue, Map.of()));
        }
    }

    /** Error counts by type for every queue. */
    public Map<String, Map<String, Long>> getErrorSummary() {
        synchronized (lock) {
            Map<String, Map<String, Long>> out = new TreeMap<>();
            errors.forEach((q, byType) -> out.put(q, new TreeMap<>(byType)));
            return out;
        }
    }

    public long getTotalPublished() { return sumCounters("messages.published."); }

    public long getTotalErrors() { return sumCounters("total_errors."); }

    /**
     * Complete snapshot: counters, gauges, timers, errors and a UTC timestamp.
     */
    public Map<String, Object> getSummary() {
        synchronized (lock) {
            Map<String, Long> counterSnapshot = new TreeMap<>();
            counters.forEach((k, v) -> counterSnapshot.put(k, v.get()));

            Map<String, Double> gaugeSnapshot = new TreeMap<>();
            gauges.forEach((k, v) -> {
                if (v.get() != null) gaugeSnapshot.put(k, v.get());
            });

            Map<String, Map<String, Object>> timerSnapshot = new TreeMap<>();
            timers.forEach((k, v) -> timerSnapshot.put(k, stats(v).toMap()));

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("counters", counterSnapshot);
            summary.put("gauges", gaugeSnapshot);
            summary.put("timers", timerSnapshot);
            summary.put("errors", getErrorSummary());
            summary.put("timestamp", Instant.now().toString());
            return summary;
        }
    }

    /** Clear every metric. The Micrometer mirror keeps its cumulative timers. */
    public void reset() {
        synchronized (lock) {
            counters.values().forEach(c -> c.set(0));
            gauges.values().forEach(g -> g.set(null));
            timers.clear();
            errors.clear();
        }
        log.info("All messaging metrics reset");
    }

    /** Clear one counter, gauge or timer by name. */
    public void reset(String name) {
        if (name == null) {
            reset();
            return;
        }
        synchronized (lock) {
            AtomicLong c = counters.get(name);
            if (c != null) c.set(0);
            AtomicReference<Double> g = gauges.get(name);
            if (g != null) g.set(null);
            timers.remove(name);
        }
        log.debug("Metric reset: {}", name);
    }

    public MeterRegistry getRegistry() { return registry; }

    // ─── Internals ──────────────────────────────────────────────────────

    /** Caller holds {@link #lock}. */
    private AtomicLong counter(String name) {
        return counters.computeIfAbsent(name, n -> {
            AtomicLong value = new AtomicLong();
            FunctionCounter.builder(PREFIX + n, value, AtomicLong::get).register(registry);
            return value;
        });
    }

    private long sumCounters(String prefix) {
        synchronized (lock) {
            return counters.entrySet().stream()
                    .filter(e -> e.getKey().startsWith(prefix))
                    .mapToLong(e -> e.getValue().get())
                    .sum();
        }
    }

    private static TimerStats stats(Deque<Double> window) {
        if (window == null || window.isEmpty()) return TimerStats.EMPTY;
        double[] sorted = window.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        double sum = Arrays.stream(sorted).sum();
        return new TimerStats(sorted.length, sorted[0], sorted[sorted.length - 1], sum / sorted.length,
                percentile(sorted, 50), percentile(sorted, 95), percentile(sorted, 99));
    }

    /** Linear interpolation between closest ranks. {@code sorted} must be ascending and non-empty. */
    static double percentile(double[] sorted, int p) {
        double k = (sorted.length - 1) * (p / 100.0);
        int f = (int) k;
        int c = f < sorted.length - 1 ? f + 1 : f;
        if (f == c) return sorted[f];
        return sorted[f] + (k - f) * (sorted[c] - sorted[f]);
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "MessagingMetrics{counters=" + counters.size() + ", timers=" + timers.size()
                    + ", gauges=" + gauges.size() + ", errors=" + errors.size() + "}";
        }
    }
}
