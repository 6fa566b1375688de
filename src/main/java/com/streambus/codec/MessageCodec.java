package com.streambus.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.streambus.domain.MessagePayload;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * JSON codec for the message envelope stored in a stream entry.
 */
@ApplicationScoped
public class MessageCodec {

    private static final Logger LOG = Logger.getLogger(MessageCodec.class);

    /** Entry field holding the serialized envelope. */
    public static final String PAYLOAD_FIELD = "payload";

    @Inject
    ObjectMapper objectMapper;

    private ObjectWriter payloadWriter;
    private ObjectReader payloadReader;

    @PostConstruct
    void init() {
        payloadWriter = objectMapper.writerFor(MessagePayload.class);
        payloadReader = objectMapper.readerFor(MessagePayload.class);
    }

    public String encode(MessagePayload message) {
        try {
            return payloadWriter.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Failed to serialize message " + message.getId(), e);
        }
    }

    public MessagePayload decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MessageFormatException("Entry has no message payload");
        }
        try {
            MessagePayload message = payloadReader.readValue(payload);
            if (message == null) {
                throw new MessageFormatException("Message payload is JSON null");
            }
            return message;
        } catch (JsonProcessingException e) {
            LOG.debugf("Failed to deserialize message payload: %s", payload);
            throw new MessageFormatException("Invalid message payload format", e);
        }
    }
}
