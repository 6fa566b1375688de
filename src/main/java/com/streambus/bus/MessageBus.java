package com.streambus.bus;

import com.streambus.codec.MessageCodec;
import com.streambus.consumer.ConsumerGroupCoordinator;
import com.streambus.consumer.ConsumerKey;
import com.streambus.consumer.ConsumerOptions;
import com.streambus.consumer.ConsumerScheduler;
import com.streambus.consumer.DuplicateConsumerException;
import com.streambus.consumer.MessageHandler;
import com.streambus.consumer.StreamConsumer;
import com.streambus.deadletter.DeadLetterRouter;
import com.streambus.domain.MessagePayload;
import com.streambus.metrics.BusMetrics;
import com.streambus.metrics.MetricsSnapshot;
import com.streambus.publish.MessagePublisher;
import com.streambus.store.LogStoreException;
import com.streambus.store.LogStoreFacade;
import com.streambus.store.PendingEntry;
import com.streambus.store.StoreHealth;
import com.streambus.store.StreamInfo;
import com.streambus.util.AlertLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the message bus: publishing, subscriptions, stream maintenance
 * and coordinated shutdown.
 *
 * <p>Delivery is at-least-once. Entries are processed in id order within one consumer's
 * batch; there is no ordering across consumers, groups or streams.
 *
 * <p>Publish errors propagate to the caller. Consumption errors are absorbed: read failures
 * back off and retry, handler failures go to the dead-letter stream.
 */
@ApplicationScoped
public class MessageBus {

    private static final Logger LOG = Logger.getLogger(MessageBus.class);

    @ConfigProperty(name = "bus.consumer.default-block-ms", defaultValue = "1000")
    long defaultBlockMs;

    @ConfigProperty(name = "bus.consumer.default-batch-size", defaultValue = "10")
    int defaultBatchSize;

    @ConfigProperty(name = "bus.consumer.default-start-id", defaultValue = "0")
    String defaultStartId;

    @ConfigProperty(name = "bus.consumer.read-error-backoff-ms", defaultValue = "5000")
    long readErrorBackoffMs;

    @ConfigProperty(name = "bus.shutdown.grace-period-ms", defaultValue = "1000")
    long shutdownGracePeriodMs;

    @ConfigProperty(name = "bus.pending.max-entries", defaultValue = "100")
    int maxPendingEntries;

    @Inject
    LogStoreFacade logStore;

    @Inject
    MessagePublisher publisher;

    @Inject
    ConsumerGroupCoordinator coordinator;

    @Inject
    DeadLetterRouter deadLetterRouter;

    @Inject
    MessageCodec codec;

    @Inject
    BusMetrics metrics;

    @Inject
    ConsumerScheduler scheduler;

    private final Map<ConsumerKey, StreamConsumer> consumers = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();
    private CompletableFuture<Void> shutdownFuture;

    /**
     * Appends a message to a stream.
     *
     * @return store-assigned entry id
     * @throws com.streambus.publish.PublishException if the store rejects the append
     */
    public String publish(String stream, MessagePayload message) {
        return publisher.publish(stream, message);
    }

    /**
     * Starts a consumer for (stream, group, consumer), creating the group and stream if needed.
     *
     * @throws DuplicateConsumerException if this process already runs that consumer
     * @throws IllegalStateException if the bus has been shut down
     */
    public void subscribe(String stream, ConsumerOptions options, MessageHandler handler) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(handler, "handler");
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("Stream name is required");
        }
        ConsumerKey key = ConsumerKey.of(stream, options);
        checkCanRegister(key);

        ConsumerOptions resolved = options.withDefaults(defaultBlockMs, defaultBatchSize, defaultStartId);
        try {
            coordinator.ensureGroup(stream, resolved.getGroup(), resolved.getStartId());
        } catch (LogStoreException e) {
            LOG.errorf(e, "Failed to subscribe to stream %s", stream);
            throw e;
        }

        StreamConsumer consumer = new StreamConsumer(key, resolved, handler, logStore, codec,
                deadLetterRouter, metrics, scheduler.executor(), readErrorBackoffMs);
        synchronized (lifecycleLock) {
            checkCanRegister(key);
            consumers.put(key, consumer);
            metrics.incrementActiveConsumers();
            consumer.start();
        }
        LOG.infof("Subscribed to stream %s: group=%s, consumer=%s", stream, key.getGroup(), key.getConsumer());
    }

    private void checkCanRegister(ConsumerKey key) {
        synchronized (lifecycleLock) {
            if (shutdownFuture != null) {
                throw new IllegalStateException("Message bus is shut down");
            }
            if (consumers.containsKey(key)) {
                throw new DuplicateConsumerException(key);
            }
        }
    }

    /**
     * Stops a consumer and removes it from its group upstream.
     * The loop exits at its next checkpoint; a batch in progress is completed.
     */
    public void unsubscribe(String stream, ConsumerOptions options) {
        ConsumerKey key = ConsumerKey.of(stream, options);
        StreamConsumer consumer = consumers.remove(key);
        if (consumer == null) {
            LOG.warnf("Consumer %s not found", key);
            return;
        }
        consumer.stop();
        metrics.decrementActiveConsumers();

        try {
            long dropped = logStore.deleteConsumer(stream, key.getGroup(), key.getConsumer());
            LOG.infof("Unsubscribed from stream %s: group=%s, consumer=%s, droppedPending=%d",
                    stream, key.getGroup(), key.getConsumer(), dropped);
        } catch (LogStoreException e) {
            LOG.errorf(e, "Failed to delete consumer %s", key);
        }
    }

    /**
     * Approximately trims a stream to {@code maxLen} entries.
     *
     * @return number of entries removed
     */
    public long trimStream(String stream, long maxLen) {
        if (maxLen < 0) {
            throw new IllegalArgumentException("maxLen must not be negative");
        }
        try {
            long trimmed = logStore.trim(stream, maxLen);
            LOG.infof("Trimmed stream %s: trimmed=%d, maxLength=%d", stream, trimmed, maxLen);
            return trimmed;
        } catch (LogStoreException e) {
            LOG.errorf(e, "Failed to trim stream %s", stream);
            throw e;
        }
    }

    public List<PendingEntry> getPendingMessages(String stream, String group) {
        try {
            return logStore.pendingList(stream, group, maxPendingEntries);
        } catch (LogStoreException e) {
            LOG.errorf(e, "Failed to get pending messages for %s:%s", stream, group);
            throw e;
        }
    }

    public Optional<StreamInfo> getStreamInfo(String stream) {
        try {
            return logStore.streamInfo(stream);
        } catch (LogStoreException e) {
            LOG.errorf(e, "Failed to get stream info for %s", stream);
            throw e;
        }
    }

    /**
     * Lists every stream in the store by scanning all keys and checking their type.
     * O(total keys): a maintenance call, not for hot paths. Refreshes the stream count metric.
     */
    public List<String> listStreams() {
        try {
            List<String> streams = new ArrayList<>();
            for (String key : logStore.keys()) {
                if ("stream".equals(logStore.typeOf(key))) {
                    streams.add(key);
                }
            }
            metrics.setStreamCount(streams.size());
            return streams;
        } catch (LogStoreException e) {
            LOG.error("Failed to list streams", e);
            throw e;
        }
    }

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    public BusHealth healthCheck() {
        try {
            List<String> streams = listStreams();
            StoreHealth storeHealth = logStore.healthCheck();
            MetricsSnapshot snapshot = metrics.snapshot();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("store", storeHealth);
            details.put("metrics", snapshot);
            details.put("streamCount", streams.size());
            details.put("activeConsumers", snapshot.getActiveConsumers());
            return new BusHealth(storeHealth.isHealthy(), details);
        } catch (Exception e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", e.getMessage() != null ? e.getMessage() : "Unknown error");
            return new BusHealth(false, details);
        }
    }

    public boolean isShutdown() {
        synchronized (lifecycleLock) {
            return shutdownFuture != null;
        }
    }

    /**
     * Stops every consumer. Repeat calls return the same future.
     * Handlers are never interrupted; one still running after the grace period is logged.
     */
    public CompletableFuture<Void> shutdown() {
        synchronized (lifecycleLock) {
            if (shutdownFuture == null) {
                shutdownFuture = CompletableFuture.runAsync(this::performShutdown,
                        r -> new Thread(r, "bus-shutdown").start());
            }
            return shutdownFuture;
        }
    }

    private void performShutdown() {
        LOG.info("Shutting down message bus...");

        List<StreamConsumer> stopping = new ArrayList<>(consumers.values());
        for (StreamConsumer consumer : stopping) {
            consumer.stop();
        }

        try {
            Thread.sleep(shutdownGracePeriodMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Shutdown grace period interrupted");
        }

        for (StreamConsumer consumer : stopping) {
            if (consumer.isBusy()) {
                AlertLogger.shutdownGraceExceeded(consumer.getKey().toString(), shutdownGracePeriodMs);
            }
        }

        consumers.clear();
        metrics.resetActiveConsumers();
        LOG.infof("Message bus shutdown complete: %d consumers stopped", stopping.size());
    }

    /**
     * Registered consumer for a key, if any.
     */
    Optional<StreamConsumer> consumer(ConsumerKey key) {
        return Optional.ofNullable(consumers.get(key));
    }
}
