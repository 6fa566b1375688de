package com.streambus.bus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the bus: store reachability plus current counters.
 */
public class BusHealth {

    private final boolean healthy;
    private final Map<String, Object> details;

    public BusHealth(boolean healthy, Map<String, Object> details) {
        this.healthy = healthy;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isHealthy() {
        return healthy;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
