package com.streambus.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Error body shared by the bus endpoints.
 */
@Schema(description = "Error response")
public class ErrorResponse {

    @Schema(example = "PUBLISH_FAILED")
    public String code;

    @Schema(example = "Failed to publish message to stream orders")
    public String message;

    @Schema(description = "Stream the request targeted", example = "orders")
    public String stream;

    public ErrorResponse(String code, String message, String stream) {
        this.code = code;
        this.message = message;
        this.stream = stream;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getStream() {
        return stream;
    }
}
