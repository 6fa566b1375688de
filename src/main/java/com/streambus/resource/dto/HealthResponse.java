package com.streambus.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Health check response.
 */
@Schema(description = "Health response")
public class HealthResponse {

    @Schema(example = "UP")
    public String status;

    @Schema(example = "true")
    public boolean healthy;

    @Schema(description = "Store health, counters, stream count and active consumers")
    public Map<String, Object> details;

    public HealthResponse(String status, boolean healthy, Map<String, Object> details) {
        this.status = status;
        this.healthy = healthy;
        this.details = details;
    }

    public String getStatus() {
        return status;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
