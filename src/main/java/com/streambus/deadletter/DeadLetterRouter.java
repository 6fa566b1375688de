package com.streambus.deadletter;

import com.streambus.codec.MessageCodec;
import com.streambus.consumer.ConsumerKey;
import com.streambus.store.LogStoreException;
import com.streambus.store.LogStoreFacade;
import com.streambus.store.StreamEntry;
import com.streambus.util.AlertLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves entries whose processing failed to {@code <stream>:dead-letter} and acknowledges
 * the original so it is not redelivered.
 *
 * <p>If the dead-letter append fails the original stays pending; the consumer picks it up
 * again from its pending list. Dead-letter entries are never replayed automatically.
 */
@ApplicationScoped
public class DeadLetterRouter {

    private static final Logger LOG = Logger.getLogger(DeadLetterRouter.class);

    public static final String FIELD_ORIGINAL_STREAM = "originalStream";
    public static final String FIELD_ORIGINAL_ENTRY_ID = "originalEntryId";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_CONSUMER_GROUP = "consumerGroup";
    public static final String FIELD_CONSUMER = "consumer";

    @ConfigProperty(name = "bus.dead-letter.suffix", defaultValue = ":dead-letter")
    String suffix;

    @Inject
    LogStoreFacade logStore;

    public String deadLetterStream(String stream) {
        return stream + suffix;
    }

    /**
     * Records the failure and acknowledges the entry.
     *
     * @return true if the original entry was acknowledged
     */
    public boolean route(ConsumerKey key, StreamEntry entry, Throwable failure) {
        String deadLetterStream = deadLetterStream(key.getStream());
        String error = describe(failure);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_ORIGINAL_STREAM, key.getStream());
        fields.put(FIELD_ORIGINAL_ENTRY_ID, entry.getId());
        fields.put(FIELD_ERROR, error);
        fields.put(FIELD_TIMESTAMP, String.valueOf(System.currentTimeMillis()));
        fields.put(FIELD_CONSUMER_GROUP, key.getGroup());
        fields.put(FIELD_CONSUMER, key.getConsumer());
        String payload = entry.getField(MessageCodec.PAYLOAD_FIELD);
        if (payload != null) {
            fields.put(MessageCodec.PAYLOAD_FIELD, payload);
        }

        try {
            logStore.append(deadLetterStream, fields);
        } catch (LogStoreException e) {
            LOG.errorf(e, "Failed to dead-letter entry %s from %s (handler error: %s)",
                    entry.getId(), key.getStream(), error);
            AlertLogger.deadLetterFailed(key.getStream(), entry.getId(), error, e.getMessage());
            return false;
        }

        try {
            logStore.ack(key.getStream(), key.getGroup(), entry.getId());
        } catch (LogStoreException e) {
            // The entry will be redelivered and dead-lettered again
            LOG.warnf(e, "Dead-lettered entry %s but failed to acknowledge it in %s/%s",
                    entry.getId(), key.getStream(), key.getGroup());
            return false;
        }

        LOG.infof("Moved failed entry to dead-letter stream: originalStream=%s, entryId=%s, deadLetterStream=%s",
                key.getStream(), entry.getId(), deadLetterStream);
        return true;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "Unknown error";
        }
        String message = failure.getMessage();
        return message != null && !message.isBlank() ? message : failure.getClass().getName();
    }
}
