package com.streambus.codec;

/**
 * A message could not be encoded to, or decoded from, its stream payload.
 */
public class MessageFormatException extends RuntimeException {
    public MessageFormatException(String message) {
        super(message);
    }

    public MessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
