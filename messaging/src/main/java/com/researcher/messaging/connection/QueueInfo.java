/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.connection;

/**
 * Passive snapshot of one queue as reported by the broker.
 */
public record QueueInfo(String name, int messageCount, int consumerCount) {
}
