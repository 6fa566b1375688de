package com.streambus.consumer;

/**
 * Subscription settings for one consumer. Unset values fall back to the bus defaults.
 */
public class ConsumerOptions {

    private final String group;
    private final String consumer;
    private Long blockMs;
    private Integer batchSize;
    private String startId;

    public ConsumerOptions(String group, String consumer) {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("Consumer group is required");
        }
        if (consumer == null || consumer.isBlank()) {
            throw new IllegalArgumentException("Consumer name is required");
        }
        this.group = group;
        this.consumer = consumer;
    }

    public static ConsumerOptions of(String group, String consumer) {
        return new ConsumerOptions(group, consumer);
    }

    /**
     * How long a read waits for new entries; 0 returns immediately.
     */
    public ConsumerOptions blockMs(long blockMs) {
        if (blockMs < 0) {
            throw new IllegalArgumentException("Block time must not be negative");
        }
        this.blockMs = blockMs;
        return this;
    }

    public ConsumerOptions batchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        this.batchSize = batchSize;
        return this;
    }

    /**
     * Position the group starts from when this subscription creates it:
     * {@code 0} for the whole stream, {@code $} for new entries only, or an entry id.
     */
    public ConsumerOptions startId(String startId) {
        this.startId = startId;
        return this;
    }

    /**
     * Copy with every unset value replaced by the given default.
     */
    public ConsumerOptions withDefaults(long defaultBlockMs, int defaultBatchSize, String defaultStartId) {
        ConsumerOptions resolved = new ConsumerOptions(group, consumer);
        resolved.blockMs = blockMs != null ? blockMs : defaultBlockMs;
        resolved.batchSize = batchSize != null ? batchSize : defaultBatchSize;
        resolved.startId = startId != null ? startId : defaultStartId;
        return resolved;
    }

    public String getGroup() {
        return group;
    }

    public String getConsumer() {
        return consumer;
    }

    public Long getBlockMs() {
        return blockMs;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public String getStartId() {
        return startId;
    }
}
