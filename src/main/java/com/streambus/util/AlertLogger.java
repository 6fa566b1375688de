package com.streambus.util;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Utility for sending structured alerts to monitoring systems.
 * <p>
 * Provides consistent alert logging with structured metadata that can be
 * detected by log aggregators (Datadog, Splunk, Loki, etc.).
 */
public final class AlertLogger {

    private AlertLogger() {}

    private static final Logger LOG = Logger.getLogger(AlertLogger.class);

    public static void deadLetterFailed(String stream, String entryId, String handlerError, String deadLetterError) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "DEAD_LETTER_FAILURE");
        alertData.put("severity", "CRITICAL");
        alertData.put("stream", stream);
        alertData.put("entry_id", entryId);
        alertData.put("handler_error", handlerError);
        alertData.put("dead_letter_error", deadLetterError);

        LOG.errorf("ALERT: Could not dead-letter entry %s of %s; left pending for redelivery. Handler error: %s. Dead-letter error: %s",
                entryId, stream, handlerError, deadLetterError);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void consumerReadFailed(String consumerKey, long backoffMs, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "CONSUMER_READ_FAILURE");
        alertData.put("severity", "WARNING");
        alertData.put("consumer", consumerKey);
        alertData.put("backoff_ms", backoffMs);
        alertData.put("error", error);

        LOG.warnf("ALERT: Read failed for consumer %s, retrying in %dms. Error: %s",
                consumerKey, backoffMs, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void shutdownGraceExceeded(String consumerKey, long gracePeriodMs) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "SHUTDOWN_GRACE_EXCEEDED");
        alertData.put("severity", "WARNING");
        alertData.put("consumer", consumerKey);
        alertData.put("grace_period_ms", gracePeriodMs);

        LOG.warnf("ALERT: Consumer %s still busy after %dms shutdown grace period; handler may be stuck",
                consumerKey, gracePeriodMs);
        LOG.debugf("Alert details: %s", alertData);
    }
}
