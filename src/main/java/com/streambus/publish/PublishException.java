package com.streambus.publish;

/**
 * A message could not be appended to its stream.
 */
public class PublishException extends RuntimeException {

    private final String stream;

    public PublishException(String stream, String message, Throwable cause) {
        super(message, cause);
        this.stream = stream;
    }

    public String getStream() {
        return stream;
    }
}
