/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.consumer;

import java.util.Set;

/**
 * Point-in-time consumer statistics.
 */
public record ConsumerStats(long received, long acked, long requeued, long deadLettered,
                            int buffered, int inFlight, boolean consuming, Set<String> subscriptions) {
}
