package com.streambus.consumer;

import com.streambus.codec.MessageCodec;
import com.streambus.codec.MessageFormatException;
import com.streambus.deadletter.DeadLetterRouter;
import com.streambus.domain.MessagePayload;
import com.streambus.metrics.BusMetrics;
import com.streambus.store.LogStore;
import com.streambus.store.LogStoreException;
import com.streambus.store.StreamEntry;
import com.streambus.util.AlertLogger;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Poll loop of one (stream, group, consumer).
 *
 * <p>Each {@link #run()} is one iteration: read a batch, hand every entry to the handler,
 * acknowledge or dead-letter it, then resubmit itself to the executor while running.
 * Stopping is cooperative: the flag is checked between iterations, never mid-batch.
 *
 * <p>The consumer first drains its own pending list (entries it was handed earlier but never
 * acknowledged), then switches to new entries. Whenever an entry is left unacknowledged the
 * pending list is checked again, which is how failed dead-letter attempts get redelivered.
 */
public class StreamConsumer implements Runnable {

    private static final Logger LOG = Logger.getLogger(StreamConsumer.class);

    private final ConsumerKey key;
    private final ConsumerOptions options;
    private final MessageHandler handler;
    private final LogStore logStore;
    private final MessageCodec codec;
    private final DeadLetterRouter deadLetterRouter;
    private final BusMetrics metrics;
    private final ScheduledExecutorService executor;
    private final long readErrorBackoffMs;

    private volatile boolean running;
    private volatile boolean checkBacklog = true;
    private final AtomicBoolean inIteration = new AtomicBoolean();
    private final AtomicLong iterations = new AtomicLong();

    public StreamConsumer(ConsumerKey key, ConsumerOptions options, MessageHandler handler,
                          LogStore logStore, MessageCodec codec, DeadLetterRouter deadLetterRouter,
                          BusMetrics metrics, ScheduledExecutorService executor, long readErrorBackoffMs) {
        this.key = key;
        this.options = options;
        this.handler = handler;
        this.logStore = logStore;
        this.codec = codec;
        this.deadLetterRouter = deadLetterRouter;
        this.metrics = metrics;
        this.executor = executor;
        this.readErrorBackoffMs = readErrorBackoffMs;
    }

    public void start() {
        running = true;
        schedule(0);
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * True while an iteration (read or handler call) is executing.
     */
    public boolean isBusy() {
        return inIteration.get();
    }

    public long getIterations() {
        return iterations.get();
    }

    public ConsumerKey getKey() {
        return key;
    }

    @Override
    public void run() {
        if (!running) {
            return;
        }
        long nextDelayMs = 0;
        inIteration.set(true);
        try {
            iterations.incrementAndGet();
            nextDelayMs = pollOnce();
        } catch (Throwable t) {
            // Whatever was in flight stays pending; re-read it on the next pass
            LOG.errorf(t, "Unexpected failure in consumer %s", key);
            checkBacklog = true;
            nextDelayMs = readErrorBackoffMs;
        } finally {
            inIteration.set(false);
        }
        if (running) {
            schedule(nextDelayMs);
        } else {
            LOG.debugf("Consumer %s stopped", key);
        }
    }

    /**
     * @return delay before the next iteration
     */
    long pollOnce() {
        boolean backlog = checkBacklog;
        List<StreamEntry> entries;
        try {
            if (backlog) {
                entries = logStore.readGroup(key.getStream(), key.getGroup(), key.getConsumer(),
                        options.getBatchSize(), 0, LogStore.FROM_BEGINNING);
            } else {
                entries = logStore.readGroup(key.getStream(), key.getGroup(), key.getConsumer(),
                        options.getBatchSize(), options.getBlockMs(), LogStore.NEW_ENTRIES);
            }
        } catch (LogStoreException e) {
            if (!running) {
                return 0;
            }
            LOG.errorf(e, "Error reading from stream %s", key.getStream());
            AlertLogger.consumerReadFailed(key.toString(), readErrorBackoffMs, e.getMessage());
            return readErrorBackoffMs;
        }

        if (backlog && entries.isEmpty()) {
            checkBacklog = false;
            return 0;
        }

        boolean leftPending = false;
        for (StreamEntry entry : entries) {
            if (!process(entry)) {
                leftPending = true;
            }
        }
        if (leftPending) {
            checkBacklog = true;
            return readErrorBackoffMs;
        }
        return 0;
    }

    /**
     * @return false if the entry was left unacknowledged
     */
    boolean process(StreamEntry entry) {
        MessagePayload message;
        try {
            message = codec.decode(entry.getField(MessageCodec.PAYLOAD_FIELD));
        } catch (MessageFormatException e) {
            return fail(entry, e);
        }
        metrics.incrementReceived();

        if (LOG.isDebugEnabled()) {
            LOG.debugf("Processing entry %s from stream %s: type=%s, source=%s",
                    entry.getId(), key.getStream(), message.getType(), message.getSource());
        }

        try {
            handler.handle(message);
        } catch (Throwable t) {
            return fail(entry, t);
        }

        try {
            logStore.ack(key.getStream(), key.getGroup(), entry.getId());
        } catch (LogStoreException e) {
            LOG.warnf(e, "Processed entry %s but failed to acknowledge it; it will be redelivered", entry.getId());
            return false;
        }
        metrics.incrementProcessed();
        LOG.debugf("Successfully processed entry %s", entry.getId());
        return true;
    }

    private boolean fail(StreamEntry entry, Throwable error) {
        metrics.incrementFailed();
        LOG.errorf(error, "Failed to process entry %s from stream %s", entry.getId(), key.getStream());
        return deadLetterRouter.route(key, entry, error);
    }

    private void schedule(long delayMs) {
        try {
            if (delayMs > 0) {
                executor.schedule(this, delayMs, TimeUnit.MILLISECONDS);
            } else {
                executor.execute(this);
            }
        } catch (RejectedExecutionException e) {
            LOG.warnf("Consumer executor rejected %s, stopping it", key);
            running = false;
        }
    }
}
