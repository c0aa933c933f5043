/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.resilience;

import java.time.Duration;

/**
 * Suspension between retry attempts. Interruptible so a retry loop can be cancelled
 * between attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> {
        if (!d.isZero() && !d.isNegative()) {
            Thread.sleep(d.toMillis(), (int) (d.toNanos() % 1_000_000));
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
