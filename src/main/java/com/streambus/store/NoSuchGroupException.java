package com.streambus.store;

/**
 * The stream or its consumer group does not exist (Redis {@code NOGROUP}).
 */
public class NoSuchGroupException extends LogStoreException {

    public NoSuchGroupException(String message) {
        super(message);
    }

    public NoSuchGroupException(String message, Throwable cause) {
        super(message, cause);
    }
}
