/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.connection;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import com.researcher.common.exception.BrokerConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Broker-side transaction on a dedicated channel, bound to the thread that opened it.
 *
 * <p>Publishes made by the owning thread while the transaction is open go through its
 * channel. {@link #commit()} makes them visible atomically; closing without a commit
 * rolls them back. Use with try-with-resources:</p>
 *
 * <pre>{@code
 * try (Transaction tx = connection.createTransaction()) {
 *     publisher.publish(a, "content.discovered");
 *     publisher.publish(b, "content.discovered");
 *     tx.commit();
 * }
 * }</pre>
 */
public final class Transaction implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Transaction.class);

    private final Channel channel;
    private final Runnable onClose;
    private boolean committed;
    private boolean closed;

    Transaction(Channel channel, Runnable onClose) {
        this.channel = channel;
        this.onClose = onClose;
    }

    /** The transactional channel. Only the owning thread may use it. */
    public Channel channel() {
        if (closed) throw new IllegalStateException("Transaction already closed");
        return channel;
    }

    public void commit() {
        if (closed) throw new IllegalStateException("Transaction already closed");
        try {
            channel.txCommit();
            committed = true;
            log.debug("Transaction committed on channel {}", channel.getChannelNumber());
        } catch (IOException | ShutdownSignalException e) {
            throw new BrokerConnectionException("Transaction commit failed", e);
        }
    }

    public boolean isCommitted() { return committed; }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            if (!committed && channel.isOpen()) {
                channel.txRollback();
                log.info("Transaction rolled back on channel {}", channel.getChannelNumber());
            }
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Transaction rollback failed: {}", e.getMessage());
        } finally {
            onClose.run();
            try {
                if (channel.isOpen()) channel.close();
            } catch (IOException | TimeoutException | ShutdownSignalException e) {
                log.debug("Error closing transaction channel: {}", e.getMessage());
            }
        }
    }
}
