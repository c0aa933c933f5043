/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging;

import com.researcher.common.config.MessagingConfig;
import com.researcher.common.config.PropertyResolver.ConfigResolutionException;
import com.researcher.common.exception.BrokerConnectionException;
import com.researcher.messaging.testing.InMemoryBroker;
import com.researcher.messaging.topology.QueueSetup;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessagingContextTest {

    private final InMemoryBroker broker = new InMemoryBroker();

    @Test
    void startConnectsAndDeclaresTopology() {
        try (MessagingContext ctx = MessagingContext.start(new MessagingConfig(), broker.connectionFactory())) {
            assertThat(ctx.connection().isConnected()).isTrue();
            assertThat(broker.hasExchange(QueueSetup.EXCHANGE)).isTrue();
            assertThat(ctx.queueSetup().checkQueuesExist()).doesNotContainValue(false);
            assertThat(ctx.publisher().healthCheck()).isTrue();
            assertThat(ctx.healthChecker().quickCheck()).isTrue();
        }
        assertThat(broker.openConnectionCount()).isZero();
    }

    @Test
    void contextsAreIsolated() {
        try (MessagingContext a = MessagingContext.start(new MessagingConfig(), broker.connectionFactory());
             MessagingContext b = MessagingContext.start(new MessagingConfig(), broker.connectionFactory())) {
            a.metrics().increment("only.in.a");

            assertThat(b.metrics().getCounter("only.in.a")).isZero();
            assertThat(a.connection()).isNotSameAs(b.connection());
            assertThat(broker.openConnectionCount()).isEqualTo(2);
        }
    }

    @Test
    void unreachableBrokerFailsStart() {
        broker.refuseConnections(true);

        assertThatThrownBy(() -> MessagingContext.start(new MessagingConfig(), broker.connectionFactory()))
                .isInstanceOf(BrokerConnectionException.class);
    }

    @Test
    void invalidConfigurationFailsBeforeConnecting() {
        MessagingConfig config = new MessagingConfig();
        config.setConsumerPrefetchCount(0);

        assertThatThrownBy(() -> MessagingContext.start(config, broker.connectionFactory()))
                .isInstanceOf(ConfigResolutionException.class);
        assertThat(broker.openConnectionCount()).isZero();
    }
}
