package com.streambus.store;

/**
 * An entry delivered to a consumer of a group but not yet acknowledged.
 */
public class PendingEntry {

    private final String entryId;
    private final String consumer;
    private final long idleMs;
    private final long deliveryCount;

    public PendingEntry(String entryId, String consumer, long idleMs, long deliveryCount) {
        this.entryId = entryId;
        this.consumer = consumer;
        this.idleMs = idleMs;
        this.deliveryCount = deliveryCount;
    }

    public String getEntryId() {
        return entryId;
    }

    public String getConsumer() {
        return consumer;
    }

    public long getIdleMs() {
        return idleMs;
    }

    public long getDeliveryCount() {
        return deliveryCount;
    }
}
