/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.metrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a timer's rolling window, in milliseconds. An empty window has count 0 and
 * zeros everywhere else.
 */
public record TimerStats(int count, double min, double max, double avg, double p50, double p95, double p99) {

    static final TimerStats EMPTY = new TimerStats(0, 0, 0, 0, 0, 0, 0);

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("count", count);
        if (count > 0) {
            m.put("min", min);
            m.put("max", max);
            m.put("avg", avg);
            m.put("p50", p50);
            m.put("p95", p95);
            m.put("p99", p99);
        }
        return m;
    }
}
