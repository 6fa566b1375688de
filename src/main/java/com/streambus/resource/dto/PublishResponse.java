package com.streambus.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Publish response")
public class PublishResponse {

    @Schema(example = "orders")
    public String stream;

    @Schema(description = "Store-assigned entry id", example = "1738829520000-0")
    public String entryId;

    public PublishResponse(String stream, String entryId) {
        this.stream = stream;
        this.entryId = entryId;
    }

    public String getStream() {
        return stream;
    }

    public String getEntryId() {
        return entryId;
    }
}
