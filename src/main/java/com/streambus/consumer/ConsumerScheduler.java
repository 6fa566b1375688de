package com.streambus.consumer;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the shared executor that runs consumer poll iterations.
 * <p>
 * Each iteration is a task that resubmits itself, so consumers share the pool
 * instead of holding a thread each.
 */
@ApplicationScoped
public class ConsumerScheduler {

    private static final Logger LOG = Logger.getLogger(ConsumerScheduler.class);

    @ConfigProperty(name = "bus.consumer.threads", defaultValue = "8")
    int threads;

    @ConfigProperty(name = "bus.store.mode", defaultValue = "redis")
    String storeMode;

    @ConfigProperty(name = "quarkus.redis.max-pool-size", defaultValue = "6")
    int redisPoolSize;

    private ScheduledExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newScheduledThreadPool(threads, consumerThreadFactory());
        LOG.infof("Consumer scheduler started with %d threads", threads);
        if (!leavesRedisConnectionsForCommands()) {
            LOG.warnf("Redis pool size %d does not exceed consumer threads %d; blocking reads can starve publish and ack",
                    redisPoolSize, threads);
        }
    }

    /**
     * Every consumer thread may sit in a blocking read, so the Redis pool needs
     * connections beyond that for other commands.
     */
    boolean leavesRedisConnectionsForCommands() {
        return !"redis".equals(storeMode) || redisPoolSize > threads;
    }

    @PreDestroy
    void stop() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Consumer threads still busy after 5s, leaving them to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for consumer threads");
        }
    }

    public ScheduledExecutorService executor() {
        return executor;
    }

    static ThreadFactory consumerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, "bus-consumer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
