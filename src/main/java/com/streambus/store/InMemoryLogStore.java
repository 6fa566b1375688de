package com.streambus.store;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.LongSupplier;

/**
 * In-process log store with Redis Streams group semantics, for tests and local runs.
 * <p>
 * All state is guarded by the instance monitor; blocking reads wait on it and are woken by appends.
 * Trimming is exact, which is one valid outcome of an approximate trim.
 */
@ApplicationScoped
@jakarta.inject.Named("in-memory-log-store")
public class InMemoryLogStore implements LogStore {

    private final Map<String, StreamLog> streams = new HashMap<>();

    LongSupplier clock = System::currentTimeMillis;

    @Override
    public synchronized String append(String stream, Map<String, String> fields) {
        StreamLog log = liveStreamOrCreate(stream);
        StreamEntryId id = StreamEntryId.next(log.lastId, clock.getAsLong());
        log.lastId = id;
        log.entries.put(id, new StreamEntry(id.toString(), fields));
        notifyAll();
        return id.toString();
    }

    @Override
    public synchronized List<StreamEntry> readGroup(String stream, String group, String consumer, int count, long blockMs, String startId) {
        long deadline = clock.getAsLong() + Math.max(blockMs, 0);
        while (true) {
            GroupState state = requireGroup(stream, group, "XREADGROUP");
            StreamLog log = streams.get(stream);

            if (!NEW_ENTRIES.equals(startId)) {
                return readOwnPending(log, state, consumer, count, StreamEntryId.parse(startId));
            }

            List<StreamEntry> batch = new ArrayList<>();
            for (StreamEntry entry : log.entries.tailMap(state.lastDelivered, false).values()) {
                if (batch.size() >= count) {
                    break;
                }
                StreamEntryId id = StreamEntryId.parse(entry.getId());
                state.pending.put(id, new PendingState(consumer, clock.getAsLong()));
                state.lastDelivered = id;
                batch.add(entry);
            }
            if (!batch.isEmpty() || blockMs <= 0) {
                return batch;
            }

            long remaining = deadline - clock.getAsLong();
            if (remaining <= 0) {
                return Collections.emptyList();
            }
            try {
                wait(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LogStoreException("Interrupted while waiting for entries on " + stream, e);
            }
        }
    }

    private List<StreamEntry> readOwnPending(StreamLog log, GroupState state, String consumer, int count, StreamEntryId after) {
        List<StreamEntry> batch = new ArrayList<>();
        for (Map.Entry<StreamEntryId, PendingState> pending : state.pending.tailMap(after, false).entrySet()) {
            if (batch.size() >= count) {
                break;
            }
            PendingState ps = pending.getValue();
            if (!consumer.equals(ps.consumer)) {
                continue;
            }
            ps.deliveredAt = clock.getAsLong();
            ps.deliveries++;
            StreamEntry entry = log.entries.get(pending.getKey());
            batch.add(entry != null ? entry : new StreamEntry(pending.getKey().toString(), null));
        }
        return batch;
    }

    @Override
    public synchronized long ack(String stream, String group, String entryId) {
        StreamLog log = liveStream(stream);
        if (log == null) {
            return 0;
        }
        GroupState state = log.groups.get(group);
        if (state == null) {
            return 0;
        }
        return state.pending.remove(StreamEntryId.parse(entryId)) != null ? 1 : 0;
    }

    @Override
    public synchronized void createGroup(String stream, String group, String startId) {
        StreamLog log = liveStreamOrCreate(stream);
        if (log.groups.containsKey(group)) {
            throw new GroupAlreadyExistsException(stream, group);
        }
        StreamEntryId start;
        if (ONLY_NEW.equals(startId)) {
            start = log.lastId;
        } else {
            start = StreamEntryId.parse(startId);
        }
        log.groups.put(group, new GroupState(start));
    }

    @Override
    public synchronized long deleteConsumer(String stream, String group, String consumer) {
        GroupState state = requireGroup(stream, group, "XGROUP DELCONSUMER");
        long dropped = state.pending.values().stream()
                .filter(ps -> consumer.equals(ps.consumer))
                .count();
        state.pending.values().removeIf(ps -> consumer.equals(ps.consumer));
        return dropped;
    }

    @Override
    public synchronized long trim(String stream, long maxLen) {
        StreamLog log = liveStream(stream);
        if (log == null) {
            return 0;
        }
        long removed = 0;
        while (log.entries.size() > maxLen) {
            log.entries.pollFirstEntry();
            removed++;
        }
        return removed;
    }

    @Override
    public synchronized List<PendingEntry> pendingList(String stream, String group, int count) {
        GroupState state = requireGroup(stream, group, "XPENDING");
        long now = clock.getAsLong();
        List<PendingEntry> result = new ArrayList<>();
        for (Map.Entry<StreamEntryId, PendingState> pending : state.pending.entrySet()) {
            if (result.size() >= count) {
                break;
            }
            PendingState ps = pending.getValue();
            result.add(new PendingEntry(pending.getKey().toString(), ps.consumer,
                    Math.max(0, now - ps.deliveredAt), ps.deliveries));
        }
        return result;
    }

    @Override
    public synchronized List<String> keys() {
        evictExpired();
        return new ArrayList<>(streams.keySet());
    }

    @Override
    public synchronized String typeOf(String key) {
        return liveStream(key) != null ? "stream" : "none";
    }

    @Override
    public synchronized boolean expire(String stream, long seconds) {
        StreamLog log = liveStream(stream);
        if (log == null) {
            return false;
        }
        log.expiresAt = clock.getAsLong() + seconds * 1000L;
        return true;
    }

    @Override
    public synchronized Optional<StreamInfo> streamInfo(String stream) {
        StreamLog log = liveStream(stream);
        if (log == null) {
            return Optional.empty();
        }
        String first = log.entries.isEmpty() ? null : log.entries.firstKey().toString();
        String last = log.entries.isEmpty() ? null : log.entries.lastKey().toString();
        return Optional.of(new StreamInfo(stream, log.entries.size(), log.groups.size(),
                log.lastId.toString(), first, last));
    }

    @Override
    public StoreHealth healthCheck() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("store", "in-memory");
        synchronized (this) {
            details.put("streams", streams.size());
        }
        return new StoreHealth(true, 0, details);
    }

    private GroupState requireGroup(String stream, String group, String command) {
        StreamLog log = liveStream(stream);
        GroupState state = log != null ? log.groups.get(group) : null;
        if (state == null) {
            throw new NoSuchGroupException("NOGROUP No such key '" + stream + "' or consumer group '"
                    + group + "' in " + command);
        }
        return state;
    }

    private StreamLog liveStreamOrCreate(String stream) {
        StreamLog log = liveStream(stream);
        if (log == null) {
            log = new StreamLog();
            streams.put(stream, log);
        }
        return log;
    }

    private StreamLog liveStream(String stream) {
        StreamLog log = streams.get(stream);
        if (log != null && log.isExpired(clock.getAsLong())) {
            streams.remove(stream);
            return null;
        }
        return log;
    }

    private void evictExpired() {
        long now = clock.getAsLong();
        streams.values().removeIf(log -> log.isExpired(now));
    }

    private static final class StreamLog {
        final TreeMap<StreamEntryId, StreamEntry> entries = new TreeMap<>();
        final Map<String, GroupState> groups = new LinkedHashMap<>();
        StreamEntryId lastId = StreamEntryId.ZERO;
        long expiresAt;

        boolean isExpired(long now) {
            return expiresAt > 0 && now >= expiresAt;
        }
    }

    private static final class GroupState {
        final TreeMap<StreamEntryId, PendingState> pending = new TreeMap<>();
        StreamEntryId lastDelivered;

        GroupState(StreamEntryId lastDelivered) {
            this.lastDelivered = lastDelivered;
        }
    }

    private static final class PendingState {
        final String consumer;
        long deliveredAt;
        long deliveries = 1;

        PendingState(String consumer, long deliveredAt) {
            this.consumer = consumer;
            this.deliveredAt = deliveredAt;
        }
    }
}
