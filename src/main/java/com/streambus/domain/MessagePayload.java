package com.streambus.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Message envelope carried in the {@code payload} field of a stream entry.
 * <p>
 * {@code data} is opaque to the bus and round-trips as whatever JSON value the producer sent.
 */
@Schema(description = "Message envelope")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessagePayload {

    @Schema(description = "Producer-assigned message id", example = "m1")
    @NotBlank(message = "Message id is required")
    private final String id;

    @Schema(description = "Message type", example = "order")
    @NotBlank(message = "Message type is required")
    private final String type;

    @Schema(description = "Producing service", example = "svc-a")
    @NotBlank(message = "Message source is required")
    private final String source;

    @Schema(description = "Intended recipient (optional)")
    private final String target;

    @Schema(description = "Opaque message body")
    private final Object data;

    @Schema(description = "Producer timestamp (epoch millis)")
    private final long timestamp;

    @Schema(description = "Seconds until the whole stream expires (optional)")
    @Positive(message = "ttl must be positive")
    private final Integer ttl;

    @JsonCreator
    public MessagePayload(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("source") String source,
            @JsonProperty("target") String target,
            @JsonProperty("data") Object data,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("ttl") Integer ttl) {
        this.id = id;
        this.type = type;
        this.source = source;
        this.target = target;
        this.data = data;
        this.timestamp = timestamp;
        this.ttl = ttl;
    }

    /**
     * Untargeted message stamped with the current time and no ttl.
     */
    public static MessagePayload of(String id, String type, String source, Object data) {
        return new MessagePayload(id, type, source, null, data, System.currentTimeMillis(), null);
    }

    public MessagePayload withTarget(String target) {
        return new MessagePayload(id, type, source, target, data, timestamp, ttl);
    }

    public MessagePayload withTtl(Integer ttl) {
        return new MessagePayload(id, type, source, target, data, timestamp, ttl);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public Object getData() {
        return data;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Integer getTtl() {
        return ttl;
    }

    @Override
    public String toString() {
        return "MessagePayload{id='" + id + "', type='" + type + "', source='" + source
                + "', target='" + target + "'}";
    }
}
