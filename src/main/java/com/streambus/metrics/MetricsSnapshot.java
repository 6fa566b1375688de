package com.streambus.metrics;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Point-in-time copy of the bus counters.
 */
@Schema(description = "Message bus counters")
public class MetricsSnapshot {

    private final long messagesSent;
    private final long messagesReceived;
    private final long messagesProcessed;
    private final long messagesFailed;
    private final long activeConsumers;
    private final long streamCount;

    public MetricsSnapshot(long messagesSent, long messagesReceived, long messagesProcessed,
                           long messagesFailed, long activeConsumers, long streamCount) {
        this.messagesSent = messagesSent;
        this.messagesReceived = messagesReceived;
        this.messagesProcessed = messagesProcessed;
        this.messagesFailed = messagesFailed;
        this.activeConsumers = activeConsumers;
        this.streamCount = streamCount;
    }

    public long getMessagesSent() {
        return messagesSent;
    }

    public long getMessagesReceived() {
        return messagesReceived;
    }

    public long getMessagesProcessed() {
        return messagesProcessed;
    }

    public long getMessagesFailed() {
        return messagesFailed;
    }

    public long getActiveConsumers() {
        return activeConsumers;
    }

    /** As of the last {@code listStreams()} call. */
    public long getStreamCount() {
        return streamCount;
    }
}
