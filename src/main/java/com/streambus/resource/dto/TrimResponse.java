package com.streambus.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Trim result. {@code trimmed} is store-dependent: the trim is approximate.
 */
@Schema(description = "Trim response")
public class TrimResponse {

    @Schema(example = "orders")
    public String stream;

    @Schema(example = "10")
    public long maxLen;

    @Schema(description = "Entries removed", example = "40")
    public long trimmed;

    public TrimResponse(String stream, long maxLen, long trimmed) {
        this.stream = stream;
        this.maxLen = maxLen;
        this.trimmed = trimmed;
    }

    public String getStream() {
        return stream;
    }

    public long getMaxLen() {
        return maxLen;
    }

    public long getTrimmed() {
        return trimmed;
    }
}
