package com.streambus.consumer;

/**
 * The (stream, group, consumer) tuple is already subscribed in this process.
 */
public class DuplicateConsumerException extends RuntimeException {

    private final ConsumerKey key;

    public DuplicateConsumerException(ConsumerKey key) {
        super("Consumer " + key + " already exists");
        this.key = key;
    }

    public ConsumerKey getKey() {
        return key;
    }
}
