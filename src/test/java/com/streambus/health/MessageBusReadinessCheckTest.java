package com.streambus.health;

import com.streambus.bus.BusHealth;
import com.streambus.bus.MessageBus;
import com.streambus.metrics.MetricsSnapshot;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class MessageBusReadinessCheckTest {

    private MessageBus bus;
    private MessageBusReadinessCheck check;

    @BeforeEach
    void setup() {
        bus = Mockito.mock(MessageBus.class);
        check = new MessageBusReadinessCheck();
        check.messageBus = bus;
    }

    @Test
    void upWhenStoreIsHealthy() {
        when(bus.healthCheck()).thenReturn(new BusHealth(true, Map.of("streamCount", 2)));
        when(bus.getMetrics()).thenReturn(new MetricsSnapshot(0, 0, 0, 0, 3, 2));

        HealthCheckResponse response = check.call();

        assertThat(response.getName()).isEqualTo("message-bus");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data ->
                assertThat(data).containsEntry("activeConsumers", 3L));
    }

    @Test
    void downWhenStoreIsUnreachable() {
        when(bus.healthCheck()).thenReturn(new BusHealth(false, Map.of("error", "connection refused")));
        when(bus.getMetrics()).thenReturn(new MetricsSnapshot(0, 0, 0, 0, 0, 0));

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data ->
                assertThat(data).containsEntry("error", "connection refused"));
    }

    @Test
    void downAfterShutdown() {
        when(bus.isShutdown()).thenReturn(true);

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }
}
