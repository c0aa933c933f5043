/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.researcher.common.config.MessagingConfig;
import com.researcher.common.exception.BrokerConnectionException;
import com.researcher.common.exception.ConsumeException;
import com.researcher.common.model.BaseMessage;
import com.researcher.common.model.MessageSchemas;
import com.researcher.common.model.QueueName;
import com.researcher.common.util.JsonUtil;
import com.researcher.messaging.connection.RabbitConnection;
import com.researcher.messaging.metrics.MessagingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes subscribed queues and turns every delivery into exactly one ack or nack.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>The broker pushes at most {@code prefetch} unacknowledged deliveries per queue.</li>
 *   <li>The client's delivery thread puts each into a bounded buffer whose capacity is the
 *       prefetch count; when the buffer is full the delivery thread blocks.</li>
 *   <li>Worker threads poll the buffer, deserialize against the queue's schema, run the
 *       handler and await its completion.</li>
 *   <li>{@link DeliveryClassifier} maps the result to a {@link DeliveryOutcome}, dispatched
 *       in one switch.</li>
 * </ol>
 *
 * <p>Failures of individual messages never escape: they become nacks and metrics.
 * Workers observe the shutdown flag within one poll interval.</p>
 */
public class MessageConsumer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessageConsumer.class);

    private final RabbitConnection connection;
    private final MessagingMetrics metrics;
    private final int prefetchCount;
    private final int workerThreads;
    private final long pollIntervalMs;
    private final DeliveryClassifier classifier = new DeliveryClassifier();

    private final Map<QueueName, Registration> registrations = new EnumMap<>(QueueName.class);
    private final Map<QueueName, String> consumerTags = new ConcurrentHashMap<>();

    private final AtomicLong receivedCount = new AtomicLong();
    private final AtomicLong ackedCount = new AtomicLong();
    private final AtomicLong requeuedCount = new AtomicLong();
    private final AtomicLong deadLetteredCount = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile boolean consuming;
    private volatile boolean shutdownRequested;
    private volatile BlockingQueue<Delivery> buffer;
    private volatile CountDownLatch stopped = new CountDownLatch(0);
    private ExecutorService workers;

    /** {@code recordsErrors}: the handler counts its own failures, see {@link InstrumentedHandler}. */
    private record Registration(Class<? extends BaseMessage> type, MessageHandler<BaseMessage> handler,
                                boolean recordsErrors) {}

    private record Delivery(QueueName queue, Channel channel, long deliveryTag, byte[] body, long receivedAtNanos) {}

    public MessageConsumer(RabbitConnection connection, MessagingMetrics metrics) {
        this(connection, metrics, connection.getConfig());
    }

    public MessageConsumer(RabbitConnection connection, MessagingMetrics metrics, MessagingConfig config) {
        this.connection = connection;
        this.metrics = metrics;
        this.prefetchCount = config.getConsumerPrefetchCount();
        this.workerThreads = config.effectiveConsumerWorkers();
        this.pollIntervalMs = config.getConsumerPollIntervalMs();
    }

    // ─── Subscription ───────────────────────────────────────────────────

    /**
     * Register the handler for a queue; it receives the queue's mapped message type.
     *
     * @throws IllegalArgumentException if the queue has no schema or already has a handler
     */
    public void subscribe(QueueName queue, MessageHandler<BaseMessage> handler) {
        Class<? extends BaseMessage> type = MessageSchemas.schemaFor(queue)
                .orElseThrow(() -> new IllegalArgumentException("No message type defined for queue " + queue));
        register(queue, type, handler, handler instanceof InstrumentedHandler);
    }

    /**
     * Typed registration. {@code type} must be the schema mapped to {@code queue}.
     */
    public <T extends BaseMessage> void subscribe(QueueName queue, Class<T> type, MessageHandler<? super T> handler) {
        Class<? extends BaseMessage> mapped = MessageSchemas.schemaFor(queue)
                .orElseThrow(() -> new IllegalArgumentException("No message type defined for queue " + queue));
        if (!mapped.equals(type)) {
            throw new IllegalArgumentException("Queue " + queue + " carries " + mapped.getSimpleName()
                    + ", not " + type.getSimpleName());
        }
        if (handler == null) throw new IllegalArgumentException("Handler must not be null");
        register(queue, type, message -> handler.handle(type.cast(message)), handler instanceof InstrumentedHandler);
    }

    private synchronized void register(QueueName queue, Class<? extends BaseMessage> type,
                                       MessageHandler<BaseMessage> handler, boolean recordsErrors) {
        if (handler == null) throw new IllegalArgumentException("Handler must not be null");
        if (registrations.containsKey(queue)) {
            throw new IllegalArgumentException("Queue " + queue + " already has a handler");
        }
        if (consuming) {
            throw new IllegalStateException("Cannot subscribe while consuming");
        }
        registrations.put(queue, new Registration(type, handler, recordsErrors));
        log.info("Registered handler for queue: {}", queue);
    }

    public synchronized Set<String> getSubscriptions() {
        Set<String> out = new LinkedHashSet<>();
        registrations.keySet().forEach(q -> out.add(q.value()));
        return out;
    }

    // ─── Lifecycle ──────────────────────────────────────────────────────

    /**
     * Set QoS, begin consuming every subscribed queue and block until {@link #stop} is called.
     * Returns immediately, with a warning, when already running or nothing is subscribed.
     *
     * @throws BrokerConnectionException if not connected
     * @throws ConsumeException if the broker refuses a consumer registration
     */
    public void start() {
        CountDownLatch latch;
        synchronized (this) {
            if (consuming) {
                log.warn("Consumer already running");
                return;
            }
            if (registrations.isEmpty()) {
                log.warn("No handlers registered, nothing to consume");
                return;
            }
            if (!connection.hasOpenConnection()) {
                throw new BrokerConnectionException("Not connected to RabbitMQ");
            }
            shutdownRequested = false;
            buffer = new ArrayBlockingQueue<>(prefetchCount);
            stopped = latch = new CountDownLatch(1);
            startWorkers();
            consuming = true;
            try {
                registerConsumers();
            } catch (IOException | TimeoutException | BrokerConnectionException e) {
                abortStart();
                throw new ConsumeException("Failed to start consuming", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abortStart();
                throw new ConsumeException("Interrupted while starting consumer", e);
            }
            log.info("Started consuming from {} queue(s): {} (prefetch={}, workers={})",
                    registrations.size(), getSubscriptions(), prefetchCount, workerThreads);
        }
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Consumer start loop interrupted, stopping");
            stop(false, Duration.ZERO);
        }
    }

    /**
     * Run {@link #start()} on a dedicated thread. The future completes when the consumer stops,
     * or exceptionally if it fails to start.
     */
    public CompletableFuture<Void> startInBackground() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        Thread t = new Thread(() -> {
            try {
                start();
                done.complete(null);
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        }, "consumer-main");
        t.setDaemon(true);
        t.start();
        return done;
    }

    private void startWorkers() {
        AtomicInteger n = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "consumer-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workerThreads; i++) {
            workers.submit(this::workerLoop);
        }
    }

    private void registerConsumers() throws IOException, InterruptedException, TimeoutException {
        connection.withChannel(ch -> {
            ch.basicQos(prefetchCount);
            for (QueueName queue : registrations.keySet()) {
                String tag = ch.basicConsume(queue.value(), false, new BufferingConsumer(ch, queue));
                consumerTags.put(queue, tag);
                log.debug("Consumer {} registered on {}", tag, queue);
            }
            return null;
        });
    }

    private void abortStart() {
        shutdownRequested = true;
        cancelConsumers();
        workers.shutdownNow();
        consuming = false;
        stopped.countDown();
    }

    /**
     * Stop consuming.
     *
     * Broker consumers are cancelled first so nothing new arrives; buffered deliveries that
     * no worker picked up are then requeued.
     *
     * @param graceful wait for in-flight handlers to finish
     * @param timeout  upper bound on that wait
     */
    public void stop(boolean graceful, Duration timeout) {
        synchronized (this) {
            if (!consuming) return;
            shutdownRequested = true;
        }
        log.info("Stopping consumer (graceful={}, timeout={})...", graceful, timeout);

        cancelConsumers();
        if (graceful) {
            long deadline = System.nanoTime() + timeout.toNanos();
            while (inFlight.get() > 0 && System.nanoTime() < deadline) {
                try {
                    Thread.sleep(Math.min(pollIntervalMs, 50));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            if (inFlight.get() > 0) {
                log.warn("{} message(s) still in flight after {}", inFlight.get(), timeout);
            }
        }

        workers.shutdownNow();
        requeueBuffered();

        synchronized (this) {
            consuming = false;
        }
        stopped.countDown();
        log.info("Consumer stopped");
    }

    /** Graceful stop with a 30 second bound. */
    public void stop() {
        stop(true, Duration.ofSeconds(30));
    }

    @Override
    public void close() {
        stop(true, Duration.ofSeconds(30));
    }

    private void cancelConsumers() {
        for (Map.Entry<QueueName, String> e : consumerTags.entrySet()) {
            try {
                connection.withChannel(ch -> {
                    ch.basicCancel(e.getValue());
                    return null;
                });
                log.debug("Consumer {} on {} cancelled", e.getValue(), e.getKey());
            } catch (IOException | TimeoutException | BrokerConnectionException | ShutdownSignalException ex) {
                log.error("Error cancelling consumer on {}: {}", e.getKey(), ex.getMessage());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.error("Interrupted cancelling consumer on {}", e.getKey());
            }
        }
        consumerTags.clear();
    }

    /** Deliveries still buffered at shutdown go back to the broker untouched. */
    private void requeueBuffered() {
        List<Delivery> leftover = new ArrayList<>();
        buffer.drainTo(leftover);
        for (Delivery d : leftover) {
            nack(d, true);
        }
        if (!leftover.isEmpty()) {
            log.info("Requeued {} buffered message(s) on shutdown", leftover.size());
        }
    }

    // ─── Delivery path ──────────────────────────────────────────────────

    private final class BufferingConsumer extends DefaultConsumer {
        private final QueueName queue;

        BufferingConsumer(Channel channel, QueueName queue) {
            super(channel);
            this.queue = queue;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                                   byte[] body) {
            receivedCount.incrementAndGet();
            Delivery delivery = new Delivery(queue, getChannel(), envelope.getDeliveryTag(), body, System.nanoTime());
            try {
                while (!buffer.offer(delivery, pollIntervalMs, TimeUnit.MILLISECONDS)) {
                    if (shutdownRequested) {
                        nack(delivery, true);
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                nack(delivery, true);
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warn("Consumer {} on {} cancelled by broker", consumerTag, queue);
            consumerTags.remove(queue);
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            if (!sig.isInitiatedByApplication()) {
                log.warn("Consumer {} on {} lost its channel: {}", consumerTag, queue, sig.getMessage());
            }
        }
    }

    private void workerLoop() {
        while (!shutdownRequested) {
            Delivery delivery;
            try {
                delivery = buffer.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (delivery == null) continue;
            inFlight.incrementAndGet();
            try {
                process(delivery);
            } catch (RuntimeException e) {
                log.error("Unexpected error settling delivery {} from {}", delivery.deliveryTag(), delivery.queue(), e);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    private void process(Delivery delivery) {
        QueueName queue = delivery.queue();
        Registration registration;
        synchronized (this) {
            registration = registrations.get(queue);
        }
        DeliveryOutcome outcome;
        boolean handlerInvoked = false;
        boolean countError = true;
        try {
            BaseMessage message = JsonUtil.fromBytes(delivery.body(), registration.type());
            log.info("Processing message {} from {}", message.getCorrelationId(), queue);
            handlerInvoked = true;
            CompletionStage<Void> result = registration.handler().handle(message);
            if (result != null) {
                result.toCompletableFuture().get();
            }
            metrics.recordMessageConsumed(queue.value());
            outcome = DeliveryOutcome.ACK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = DeliveryOutcome.requeue("interrupted");
            countError = false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            outcome = classifier.classify(cause);
            logFailure(queue, outcome, cause);
        } catch (Exception | Error e) {
            // Errors from a handler are per-message failures too; the worker keeps running.
            outcome = classifier.classify(e);
            logFailure(queue, outcome, e);
        }
        boolean alreadyCounted = handlerInvoked && registration.recordsErrors() && !outcome.brokerOriginated();
        dispatch(delivery, outcome, countError && !alreadyCounted);
    }

    private void dispatch(Delivery delivery, DeliveryOutcome outcome, boolean countError) {
        String queue = delivery.queue().value();
        switch (outcome.action()) {
            case ACK -> {
                if (ack(delivery)) {
                    ackedCount.incrementAndGet();
                    metrics.recordMessageAcked(queue);
                    metrics.recordTime("consumed." + queue, elapsedMs(delivery));
                }
            }
            case NACK_REQUEUE -> {
                if (nack(delivery, true)) {
                    requeuedCount.incrementAndGet();
                    metrics.recordMessageNacked(queue, true);
                    if (countError) {
                        metrics.recordError(queue, outcome.reason());
                    }
                }
            }
            case NACK_DLQ -> {
                if (nack(delivery, false)) {
                    deadLetteredCount.incrementAndGet();
                    metrics.recordMessageNacked(queue, false);
                    metrics.recordDlqMessage(queue, outcome.reason());
                    if (countError) {
                        metrics.recordError(queue, outcome.reason());
                    }
                }
            }
        }
    }

    private void logFailure(QueueName queue, DeliveryOutcome outcome, Throwable error) {
        String detail = error != null ? error.getMessage() : "unknown";
        if (outcome.action() == DeliveryAction.NACK_DLQ) {
            log.error("Permanent failure ({}) on message from {}, dead-lettering: {}", outcome.reason(), queue, detail);
        } else {
            log.warn("Transient failure ({}) on message from {}, requeuing: {}", outcome.reason(), queue, detail);
        }
    }

    private boolean ack(Delivery d) {
        return settle(d, "ack", ch -> ch.basicAck(d.deliveryTag(), false));
    }

    private boolean nack(Delivery d, boolean requeue) {
        return settle(d, requeue ? "nack(requeue)" : "nack", ch -> ch.basicNack(d.deliveryTag(), false, requeue));
    }

    @FunctionalInterface
    private interface Settlement {
        void apply(Channel channel) throws IOException;
    }

    /**
     * Acks and nacks go through the connection's serialized channel accessor. A delivery
     * whose channel has since been replaced is left alone: the broker requeued it when the
     * old channel closed, and its tag means nothing on the new one.
     */
    private boolean settle(Delivery d, String what, Settlement settlement) {
        try {
            boolean settled = connection.withChannel(ch -> {
                if (ch != d.channel()) {
                    return false;
                }
                settlement.apply(ch);
                return true;
            });
            if (!settled) {
                log.warn("Skipping {} of delivery {} on {}: its channel closed, the broker redelivers it",
                        what, d.deliveryTag(), d.queue());
            }
            return settled;
        } catch (IOException | TimeoutException | BrokerConnectionException | ShutdownSignalException e) {
            log.error("Failed to {} delivery {} on {}: {}", what, d.deliveryTag(), d.queue(), e.getMessage());
            metrics.recordError(d.queue().value(), "settle_failed");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted during {} of delivery {} on {}", what, d.deliveryTag(), d.queue());
            return false;
        }
    }

    private static double elapsedMs(Delivery d) {
        return (System.nanoTime() - d.receivedAtNanos()) / 1_000_000.0;
    }

    // ─── Introspection ──────────────────────────────────────────────────

    /** Connected and consuming. */
    public boolean healthCheck() {
        try {
            return consuming && connection.isConnected();
        } catch (RuntimeException e) {
            log.error("Consumer health check failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean isConsuming() { return consuming; }

    public ConsumerStats getStats() {
        BlockingQueue<Delivery> b = buffer;
        return new ConsumerStats(receivedCount.get(), ackedCount.get(), requeuedCount.get(),
                deadLetteredCount.get(), b == null ? 0 : b.size(), inFlight.get(), consuming, getSubscriptions());
    }

    @Override
    public String toString() {
        return "MessageConsumer{consuming=" + consuming + ", subscriptions=" + getSubscriptions() + "}";
    }
}
