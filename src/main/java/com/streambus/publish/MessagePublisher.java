package com.streambus.publish;

import com.streambus.codec.MessageCodec;
import com.streambus.codec.MessageFormatException;
import com.streambus.domain.MessagePayload;
import com.streambus.metrics.BusMetrics;
import com.streambus.store.LogStoreException;
import com.streambus.store.LogStoreFacade;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Appends message envelopes to streams.
 *
 * <p>No retry is attempted: a store that is down or rejecting writes surfaces
 * to the caller as {@link PublishException}.
 */
@ApplicationScoped
public class MessagePublisher {

    private static final Logger LOG = Logger.getLogger(MessagePublisher.class);

    @Inject
    LogStoreFacade logStore;

    @Inject
    MessageCodec codec;

    @Inject
    BusMetrics metrics;

    /**
     * Publishes a message and applies its ttl to the whole stream.
     *
     * @return store-assigned entry id
     */
    public String publish(String stream, MessagePayload message) {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("Stream name is required");
        }
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }

        String entryId;
        try {
            String payload = codec.encode(message);
            entryId = logStore.append(stream, Map.of(MessageCodec.PAYLOAD_FIELD, payload));
        } catch (MessageFormatException | LogStoreException e) {
            LOG.errorf(e, "Failed to publish message %s to stream %s", message.getId(), stream);
            throw new PublishException(stream, "Failed to publish message to stream " + stream, e);
        }
        metrics.incrementSent();

        if (LOG.isDebugEnabled()) {
            LOG.debugf("Message published to stream %s: entryId=%s, type=%s, source=%s, target=%s",
                    stream, entryId, message.getType(), message.getSource(), message.getTarget());
        }

        Integer ttl = message.getTtl();
        if (ttl != null && ttl > 0) {
            try {
                logStore.expire(stream, ttl);
            } catch (LogStoreException e) {
                LOG.errorf(e, "Published %s to %s but failed to set ttl %ds", entryId, stream, ttl);
                throw new PublishException(stream, "Failed to set expiration on stream " + stream, e);
            }
        }
        return entryId;
    }
}
