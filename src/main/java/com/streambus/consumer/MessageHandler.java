package com.streambus.consumer;

import com.streambus.domain.MessagePayload;

/**
 * Application callback for consumed messages. Throwing dead-letters the entry.
 * <p>
 * Delivery is at-least-once, so implementations must tolerate duplicates.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(MessagePayload message) throws Exception;
}
