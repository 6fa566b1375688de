package com.streambus.store;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Facade that selects the active LogStore implementation based on configuration.
 */
@ApplicationScoped
public class LogStoreFacade implements LogStore {

    private static final Logger LOG = Logger.getLogger(LogStoreFacade.class);

    @ConfigProperty(name = "bus.store.mode", defaultValue = "redis")
    String mode;

    @Inject
    @Named("redis-log-store")
    RedisLogStore redisStore;

    @Inject
    @Named("in-memory-log-store")
    InMemoryLogStore inMemoryStore;

    @PostConstruct
    void init() {
        LOG.infof("Log store mode: %s", isInMemory() ? "in-memory" : "redis");
    }

    private boolean isInMemory() {
        return "in-memory".equalsIgnoreCase(mode);
    }

    private LogStore delegate() {
        if (isInMemory()) {
            return inMemoryStore;
        }
        return redisStore;
    }

    @Override
    public String append(String stream, Map<String, String> fields) {
        return delegate().append(stream, fields);
    }

    @Override
    public List<StreamEntry> readGroup(String stream, String group, String consumer, int count, long blockMs, String startId) {
        return delegate().readGroup(stream, group, consumer, count, blockMs, startId);
    }

    @Override
    public long ack(String stream, String group, String entryId) {
        return delegate().ack(stream, group, entryId);
    }

    @Override
    public void createGroup(String stream, String group, String startId) {
        delegate().createGroup(stream, group, startId);
    }

    @Override
    public long deleteConsumer(String stream, String group, String consumer) {
        return delegate().deleteConsumer(stream, group, consumer);
    }

    @Override
    public long trim(String stream, long maxLen) {
        return delegate().trim(stream, maxLen);
    }

    @Override
    public List<PendingEntry> pendingList(String stream, String group, int count) {
        return delegate().pendingList(stream, group, count);
    }

    @Override
    public List<String> keys() {
        return delegate().keys();
    }

    @Override
    public String typeOf(String key) {
        return delegate().typeOf(key);
    }

    @Override
    public boolean expire(String stream, long seconds) {
        return delegate().expire(stream, seconds);
    }

    @Override
    public Optional<StreamInfo> streamInfo(String stream) {
        return delegate().streamInfo(stream);
    }

    @Override
    public StoreHealth healthCheck() {
        return delegate().healthCheck();
    }
}
