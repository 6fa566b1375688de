package com.streambus.store;

/**
 * Raised when a log store command fails or the store cannot be reached.
 */
public class LogStoreException extends RuntimeException {
    public LogStoreException(String message) {
        super(message);
    }

    public LogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
