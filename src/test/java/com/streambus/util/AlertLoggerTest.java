package com.streambus.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class AlertLoggerTest {

    @Test
    void deadLetterFailedDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.deadLetterFailed("orders", "1-0", "boom", "OOM command not allowed"));
    }

    @Test
    void consumerReadFailedDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.consumerReadFailed("orders:workers:w1", 5000, "connection reset"));
    }

    @Test
    void shutdownGraceExceededDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.shutdownGraceExceeded("orders:workers:w1", 1000));
    }

    @Test
    void nullErrorsDoNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.deadLetterFailed("orders", "1-0", null, null));
    }
}
