package com.streambus.consumer;

import java.util.Objects;

/**
 * Identity of a consumer: (stream, group, consumer name).
 */
public final class ConsumerKey {

    private final String stream;
    private final String group;
    private final String consumer;

    public ConsumerKey(String stream, String group, String consumer) {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.group = Objects.requireNonNull(group, "group");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
    }

    public static ConsumerKey of(String stream, ConsumerOptions options) {
        return new ConsumerKey(stream, options.getGroup(), options.getConsumer());
    }

    public String getStream() {
        return stream;
    }

    public String getGroup() {
        return group;
    }

    public String getConsumer() {
        return consumer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConsumerKey)) {
            return false;
        }
        ConsumerKey that = (ConsumerKey) o;
        return stream.equals(that.stream) && group.equals(that.group) && consumer.equals(that.consumer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stream, group, consumer);
    }

    @Override
    public String toString() {
        return stream + ":" + group + ":" + consumer;
    }
}
