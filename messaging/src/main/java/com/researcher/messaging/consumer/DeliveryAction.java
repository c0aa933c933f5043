/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.consumer;

/**
 * What to tell the broker about one delivery.
 */
public enum DeliveryAction {
    ACK,
    NACK_REQUEUE,
    NACK_DLQ
}
