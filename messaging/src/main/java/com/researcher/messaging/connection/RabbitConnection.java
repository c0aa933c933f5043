/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.connection;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.researcher.common.config.MessagingConfig;
import com.researcher.common.exception.BrokerConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Owns one long-lived AMQP connection and one shared channel.
 *
 * <h3>Channel discipline</h3>
 * <ul>
 *   <li>{@link #withChannel} is the single serialized accessor for the shared channel;
 *       publisher sends, consumer acks and topology declarations all go through it</li>
 *   <li>{@link #channel()} fails fast with {@link BrokerConnectionException} when the
 *       connection is gone, and replaces a channel the broker closed with a channel error</li>
 *   <li>Passive inspection and purges use a short-lived side channel, so a 404 from the
 *       broker never closes the shared one</li>
 *   <li>Transactions get their own channel, see {@link #createTransaction()}</li>
 * </ul>
 *
 * <p>A shutdown listener flags unexpected closure. With automatic recovery enabled the
 * client reconnects on its own and a recovery listener marks the connection usable again.</p>
 */
public class RabbitConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RabbitConnection.class);
    private static final String CONNECTION_NAME = "researcher-messaging";

    private static final Object SHARED_LOCK = new Object();
    private static RabbitConnection shared;

    private final MessagingConfig config;
    private final ConnectionFactory factory;
    private final Object lifecycleLock = new Object();
    private final Object channelLock = new Object();
    private final ThreadLocal<Transaction> currentTransaction = new ThreadLocal<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Connection connection;
    private volatile Channel channel;
    private volatile boolean confirmsEnabled;

    public RabbitConnection(MessagingConfig config) {
        this(config, new ConnectionFactory());
    }

    public RabbitConnection(MessagingConfig config, ConnectionFactory factory) {
        this.config = config;
        this.factory = factory;
    }

    /**
     * Process-wide connection, created and connected once under a lock so concurrent first
     * callers never open duplicate connections.
     */
    public static RabbitConnection shared(MessagingConfig config) {
        return shared(config, new ConnectionFactory());
    }

    /** As {@link #shared(MessagingConfig)}; {@code factory} is used only by the creating call. */
    public static RabbitConnection shared(MessagingConfig config, ConnectionFactory factory) {
        synchronized (SHARED_LOCK) {
            if (shared == null) {
                RabbitConnection c = new RabbitConnection(config, factory);
                c.connect();
                shared = c;
                log.debug("Shared RabbitMQ connection created");
            }
            return shared;
        }
    }

    /** Close and forget the process-wide connection, if any. */
    public static void disconnectShared() {
        synchronized (SHARED_LOCK) {
            if (shared != null) {
                shared.close();
                shared = null;
                log.info("Shared RabbitMQ connection closed");
            }
        }
    }

    // ─── Lifecycle ──────────────────────────────────────────────────────

    /**
     * Open the connection and shared channel. A no-op when already connected.
     *
     * @throws BrokerConnectionException when the broker is unreachable or rejects the login
     */
    public void connect() {
        synchronized (lifecycleLock) {
            if (isConnected()) {
                log.debug("Already connected to RabbitMQ");
                return;
            }
            if (hasOpenConnection()) {
                reopenChannel();
                return;
            }
            state = ConnectionState.CONNECTING;
            configureFactory();
            log.info("Connecting to RabbitMQ at {}:{}{}", config.getHost(), config.getPort(),
                    config.getVirtualHost());
            try {
                Connection conn = factory.newConnection(CONNECTION_NAME);
                Channel ch = conn.createChannel();
                conn.addShutdownListener(this::onConnectionShutdown);
                ch.addShutdownListener(this::onChannelShutdown);
                if (conn instanceof Recoverable recoverable) {
                    recoverable.addRecoveryListener(new StateRecoveryListener());
                }
                this.connection = conn;
                this.channel = ch;
                this.confirmsEnabled = false;
                state = ConnectionState.CONNECTED;
                log.info("Connected to RabbitMQ (automaticRecovery={}, heartbeat={}s)",
                        config.isAutomaticRecovery(), config.getHeartbeatSeconds());
            } catch (IOException | TimeoutException e) {
                state = ConnectionState.ERROR;
                log.error("Failed to connect to RabbitMQ at {}:{}", config.getHost(), config.getPort(), e);
                throw new BrokerConnectionException(
                        "Failed to connect to RabbitMQ at " + config.getHost() + ":" + config.getPort(), e);
            }
        }
    }

    private void configureFactory() {
        factory.setHost(config.getHost());
        factory.setPort(config.getPort());
        factory.setUsername(config.getUser());
        factory.setPassword(config.getPassword());
        factory.setVirtualHost(config.getVirtualHost());
        factory.setRequestedHeartbeat(config.getHeartbeatSeconds());
        factory.setConnectionTimeout(config.getConnectionTimeoutSeconds() * 1000);
        factory.setAutomaticRecoveryEnabled(config.isAutomaticRecovery());
        factory.setTopologyRecoveryEnabled(config.isAutomaticRecovery());
        factory.setNetworkRecoveryInterval(config.getNetworkRecoveryIntervalMs());
    }

    private void onConnectionShutdown(ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) return;
        state = config.isAutomaticRecovery() ? ConnectionState.RECONNECTING : ConnectionState.DISCONNECTED;
        log.warn("RabbitMQ connection closed unexpectedly: {} (state={})", cause.getMessage(), state);
    }

    private void onChannelShutdown(ShutdownSignalException cause) {
        if (!cause.isInitiatedByApplication() && !cause.isHardError()) {
            log.warn("Shared channel closed by broker, reopened on next use: {}", cause.getMessage());
        }
    }

    /**
     * Replace a shared channel the broker closed while the connection stayed up. The client's
     * automatic recovery only restores channels lost with their connection.
     */
    private Channel reopenChannel() {
        synchronized (lifecycleLock) {
            Channel current = channel;
            if (current != null && current.isOpen()) {
                return current;
            }
            if (!hasOpenConnection()) {
                throw new BrokerConnectionException("Not connected to RabbitMQ. Call connect() first.");
            }
            try {
                Channel ch = connection.createChannel();
                if (ch == null) {
                    throw new IOException("No channel available on the connection");
                }
                ch.addShutdownListener(this::onChannelShutdown);
                if (confirmsEnabled) {
                    ch.confirmSelect();
                }
                channel = ch;
                log.info("Shared channel reopened (channel {}, confirms={})", ch.getChannelNumber(), confirmsEnabled);
                return ch;
            } catch (IOException e) {
                log.error("Failed to reopen shared channel", e);
                throw new BrokerConnectionException("Failed to reopen RabbitMQ channel", e);
            }
        }
    }

    private final class StateRecoveryListener implements RecoveryListener {
        @Override
        public void handleRecoveryStarted(Recoverable recoverable) {
            state = ConnectionState.RECONNECTING;
            log.info("RabbitMQ connection recovery started");
        }

        @Override
        public void handleRecovery(Recoverable recoverable) {
            state = ConnectionState.CONNECTED;
            log.info("RabbitMQ connection recovered");
        }
    }

    /**
     * Close the shared channel and the connection. Safe to call more than once; a later
     * {@link #connect()} opens a fresh connection.
     */
    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (connection == null) {
                log.debug("Not connected, nothing to close");
                return;
            }
            state = ConnectionState.CLOSING;
            log.info("Closing RabbitMQ connection...");
            try {
                if (channel != null && channel.isOpen()) channel.close();
            } catch (IOException | TimeoutException | ShutdownSignalException e) {
                log.warn("Error closing RabbitMQ channel: {}", e.getMessage());
            }
            try {
                if (connection.isOpen()) connection.close();
            } catch (IOException | ShutdownSignalException e) {
                log.warn("Error closing RabbitMQ connection: {}", e.getMessage());
            }
            channel = null;
            connection = null;
            confirmsEnabled = false;
            state = ConnectionState.CLOSED;
            log.info("RabbitMQ connection closed");
        }
    }

    /** Alias of {@link #close()}. */
    public void disconnect() { close(); }

    /** Connection up and shared channel open. */
    public boolean isConnected() {
        Channel ch = channel;
        return hasOpenConnection() && ch != null && ch.isOpen();
    }

    /**
     * Connection up, whether or not the shared channel survived. Callers that go through
     * {@link #withChannel} get a replacement channel on demand.
     */
    public boolean hasOpenConnection() {
        Connection conn = connection;
        return state == ConnectionState.CONNECTED && conn != null && conn.isOpen();
    }

    public ConnectionState getState() { return state; }

    // ─── Channel access ─────────────────────────────────────────────────

    /**
     * The shared channel, reopened first if the broker closed it. Prefer {@link #withChannel}
     * for anything that writes to it.
     *
     * @throws BrokerConnectionException if not connected or the channel cannot be reopened
     */
    public Channel channel() {
        if (!hasOpenConnection()) {
            throw new BrokerConnectionException("Not connected to RabbitMQ. Call connect() first.");
        }
        Channel ch = channel;
        if (ch == null || !ch.isOpen()) {
            ch = reopenChannel();
        }
        return ch;
    }

    /**
     * Run {@code callback} on the shared channel, serialized with every other user of it.
     */
    public <T> T withChannel(ChannelCallback<T> callback) throws IOException, InterruptedException, TimeoutException {
        synchronized (channelLock) {
            return callback.doInChannel(channel());
        }
    }

    /** Switch the shared channel into publisher-confirm mode. Idempotent. */
    public void enablePublisherConfirms() {
        if (confirmsEnabled) return;
        try {
            withChannel(ch -> ch.confirmSelect());
            confirmsEnabled = true;
            log.info("Publisher confirms enabled");
        } catch (IOException | TimeoutException e) {
            throw new BrokerConnectionException("Failed to enable publisher confirms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("Interrupted enabling publisher confirms", e);
        }
    }

    public boolean isConfirmsEnabled() { return confirmsEnabled; }

    // ─── Administration ─────────────────────────────────────────────────

    /**
     * Message and consumer counts of a queue, or empty when the queue does not exist.
     */
    public Optional<QueueInfo> getQueueInfo(String queueName) {
        return onSideChannel("inspect queue " + queueName, ch -> {
            try {
                AMQP.Queue.DeclareOk ok = ch.queueDeclarePassive(queueName);
                return Optional.of(new QueueInfo(queueName, ok.getMessageCount(), ok.getConsumerCount()));
            } catch (IOException e) {
                if (replyCode(e) == AMQP.NOT_FOUND) {
                    log.debug("Queue {} does not exist", queueName);
                    return Optional.empty();
                }
                throw e;
            }
        });
    }

    /**
     * Drop every ready message of a queue.
     *
     * @return number of messages purged
     */
    public int purgeQueue(String queueName) {
        int purged = onSideChannel("purge queue " + queueName, ch -> ch.queuePurge(queueName).getMessageCount());
        log.info("Purged {} messages from {}", purged, queueName);
        return purged;
    }

    private <T> T onSideChannel(String what, ChannelCallback<T> callback) {
        Channel side = null;
        try {
            side = openChannel();
            return callback.doInChannel(side);
        } catch (IOException | TimeoutException e) {
            log.error("Failed to {}", what, e);
            throw new BrokerConnectionException("Failed to " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("Interrupted while trying to " + what, e);
        } finally {
            closeQuietly(side);
        }
    }

    private Channel openChannel() throws IOException {
        if (!hasOpenConnection()) {
            throw new BrokerConnectionException("Not connected to RabbitMQ. Call connect() first.");
        }
        Channel ch = connection.createChannel();
        if (ch == null) {
            throw new IOException("No channel available on the connection");
        }
        return ch;
    }

    /** AMQP reply code carried by a channel-closing {@link IOException}, or -1. */
    static int replyCode(IOException e) {
        if (e.getCause() instanceof ShutdownSignalException sse
                && sse.getReason() instanceof AMQP.Channel.Close close) {
            return close.getReplyCode();
        }
        return -1;
    }

    private static void closeQuietly(Channel ch) {
        if (ch == null || !ch.isOpen()) return;
        try {
            ch.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.debug("Error closing side channel: {}", e.getMessage());
        }
    }

    // ─── Transactions ───────────────────────────────────────────────────

    /**
     * Begin a broker-side transaction on a dedicated channel bound to the calling thread.
     * Nested transactions on one thread are rejected.
     */
    public Transaction createTransaction() {
        if (currentTransaction.get() != null) {
            throw new IllegalStateException("A transaction is already open on this thread");
        }
        try {
            Channel txChannel = openChannel();
            txChannel.txSelect();
            Transaction tx = new Transaction(txChannel, currentTransaction::remove);
            currentTransaction.set(tx);
            log.debug("Transaction started on channel {}", txChannel.getChannelNumber());
            return tx;
        } catch (IOException e) {
            throw new BrokerConnectionException("Failed to start transaction", e);
        }
    }

    /**
     * Run {@code work} inside a transaction: committed when it returns normally, rolled back
     * when it throws. The exception propagates unchanged.
     */
    public <T> T inTransaction(Function<Transaction, T> work) {
        try (Transaction tx = createTransaction()) {
            T result = work.apply(tx);
            tx.commit();
            return result;
        }
    }

    /** The transaction open on the calling thread, if any. */
    public Optional<Transaction> currentTransaction() {
        return Optional.ofNullable(currentTransaction.get());
    }

    public MessagingConfig getConfig() { return config; }

    @Override
    public String toString() {
        return "RabbitConnection{state=" + state + ", host=" + config.getHost() + "}";
    }
}
