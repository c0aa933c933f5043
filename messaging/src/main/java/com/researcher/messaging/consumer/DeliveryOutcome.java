/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.consumer;

/**
 * Classified result of processing one delivery.
 *
 * @param reason           metric-safe reason, {@code null} for an ack
 * @param brokerOriginated the failure came from the broker (channel closed under us),
 *                         not from the payload or the handler
 */
public record DeliveryOutcome(DeliveryAction action, String reason, boolean brokerOriginated) {

    public static final DeliveryOutcome ACK = new DeliveryOutcome(DeliveryAction.ACK, null, false);

    public static DeliveryOutcome requeue(String reason) {
        return new DeliveryOutcome(DeliveryAction.NACK_REQUEUE, reason, false);
    }

    public static DeliveryOutcome deadLetter(String reason) {
        return new DeliveryOutcome(DeliveryAction.NACK_DLQ, reason, false);
    }

    static DeliveryOutcome broker(DeliveryAction action, String reason) {
        return new DeliveryOutcome(action, reason, true);
    }
}
