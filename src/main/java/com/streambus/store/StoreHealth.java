package com.streambus.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a log store health check.
 */
public class StoreHealth {

    private final boolean healthy;
    private final long latencyMs;
    private final Map<String, Object> details;

    public StoreHealth(boolean healthy, long latencyMs, Map<String, Object> details) {
        this.healthy = healthy;
        this.latencyMs = latencyMs;
        this.details = details == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isHealthy() {
        return healthy;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
