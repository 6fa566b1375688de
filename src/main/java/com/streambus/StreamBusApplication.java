package com.streambus;

import com.streambus.bus.MessageBus;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main application class.
 * <p>
 * Quarkus owns signal handling; the bus itself never exits the process and is
 * stopped from {@link ApplicationLifecycleObserver} on shutdown.
 */
@QuarkusMain
public class StreamBusApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(StreamBusApplication.class);

    public static void main(String[] args) {
        Quarkus.run(StreamBusApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Stream Message Bus starting...");
        Quarkus.waitForExit();
        return 0;
    }
}

/**
 * Lifecycle host for the message bus: stops all consumers once when Quarkus shuts down.
 */
@ApplicationScoped
class ApplicationLifecycleObserver {

    private static final Logger LOG = Logger.getLogger(ApplicationLifecycleObserver.class);

    @Inject
    MessageBus messageBus;

    @ConfigProperty(name = "bus.shutdown.grace-period-ms", defaultValue = "1000")
    long shutdownGracePeriodMs;

    void onStart(@Observes StartupEvent event) {
        LOG.info("Stream Message Bus started successfully");
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Shutdown signal received, stopping message bus consumers...");
        try {
            // Grace period plus headroom for the registry cleanup
            messageBus.shutdown().get(shutdownGracePeriodMs + 5000, TimeUnit.MILLISECONDS);
            LOG.info("Graceful shutdown complete");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Shutdown wait interrupted");
        } catch (ExecutionException e) {
            LOG.errorf(e.getCause(), "Message bus shutdown failed");
        } catch (TimeoutException e) {
            LOG.warnf("Message bus shutdown did not finish within %dms", shutdownGracePeriodMs + 5000);
        }
    }
}
