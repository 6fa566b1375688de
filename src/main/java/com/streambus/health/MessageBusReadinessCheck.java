package com.streambus.health;

import com.streambus.bus.BusHealth;
import com.streambus.bus.MessageBus;
import com.streambus.metrics.MetricsSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports the bus as not ready once it is shut down or its store is unreachable.
 */
@Readiness
@ApplicationScoped
public class MessageBusReadinessCheck implements HealthCheck {

    @Inject
    MessageBus messageBus;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("message-bus");
        if (messageBus.isShutdown()) {
            return builder.down().withData("reason", "shut down").build();
        }
        BusHealth health = messageBus.healthCheck();
        MetricsSnapshot metrics = messageBus.getMetrics();
        builder.withData("activeConsumers", metrics.getActiveConsumers())
                .withData("streamCount", metrics.getStreamCount());
        Object error = health.getDetails().get("error");
        if (error != null) {
            builder.withData("error", error.toString());
        }
        return health.isHealthy() ? builder.up().build() : builder.down().build();
    }
}
