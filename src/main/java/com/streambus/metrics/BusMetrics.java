package com.streambus.metrics;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight in-process counters for the message bus.
 * <p>
 * Exposed via {@code /v1/bus/metrics}. Counters live for the lifetime of the process.
 */
@ApplicationScoped
public class BusMetrics {

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong messagesProcessed = new AtomicLong();
    private final AtomicLong messagesFailed = new AtomicLong();
    private final AtomicLong activeConsumers = new AtomicLong();
    private final AtomicLong streamCount = new AtomicLong();

    public void incrementSent() {
        messagesSent.incrementAndGet();
    }

    public void incrementReceived() {
        messagesReceived.incrementAndGet();
    }

    public void incrementProcessed() {
        messagesProcessed.incrementAndGet();
    }

    public void incrementFailed() {
        messagesFailed.incrementAndGet();
    }

    public void incrementActiveConsumers() {
        activeConsumers.incrementAndGet();
    }

    public void decrementActiveConsumers() {
        activeConsumers.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public void resetActiveConsumers() {
        activeConsumers.set(0);
    }

    public void setStreamCount(long count) {
        streamCount.set(count);
    }

    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                messagesSent.get(),
                messagesReceived.get(),
                messagesProcessed.get(),
                messagesFailed.get(),
                activeConsumers.get(),
                streamCount.get());
    }
}
