package com.streambus;

import com.streambus.bus.MessageBus;
import io.quarkus.runtime.Quarkus;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamBusApplicationTest {

    @Test
    void mainInvokesQuarkusRun() {
        try (MockedStatic<Quarkus> quarkus = Mockito.mockStatic(Quarkus.class)) {
            StreamBusApplication.main(new String[]{"arg"});
            quarkus.verify(() -> Quarkus.run(StreamBusApplication.class, new String[]{"arg"}));
        }
    }

    @Test
    void runWaitsForExitAndReturnsZero() throws Exception {
        try (MockedStatic<Quarkus> quarkus = Mockito.mockStatic(Quarkus.class)) {
            quarkus.when(Quarkus::waitForExit).thenAnswer(invocation -> null);

            StreamBusApplication app = new StreamBusApplication();
            int result = app.run();

            assertThat(result).isEqualTo(0);
            quarkus.verify(Quarkus::waitForExit);
        }
    }

    @Test
    void shutdownEventStopsMessageBus() {
        MessageBus bus = Mockito.mock(MessageBus.class);
        when(bus.shutdown()).thenReturn(CompletableFuture.completedFuture(null));
        ApplicationLifecycleObserver observer = new ApplicationLifecycleObserver();
        observer.messageBus = bus;
        observer.shutdownGracePeriodMs = 100;

        observer.onShutdown(null);

        verify(bus).shutdown();
    }

    @Test
    void failedBusShutdownIsLoggedNotThrown() {
        MessageBus bus = Mockito.mock(MessageBus.class);
        when(bus.shutdown()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        ApplicationLifecycleObserver observer = new ApplicationLifecycleObserver();
        observer.messageBus = bus;
        observer.shutdownGracePeriodMs = 100;

        assertDoesNotThrow(() -> observer.onShutdown(null));
    }
}
