package com.streambus.store;

import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Response;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redis Streams backed log store.
 * <p>
 * Expects RESP2 replies: stream reads and {@code XINFO} are parsed as flat arrays.
 */
@ApplicationScoped
@jakarta.inject.Named("redis-log-store")
public class RedisLogStore implements LogStore {

    private static final Logger LOG = Logger.getLogger(RedisLogStore.class);

    @ConfigProperty(name = "bus.store.redis-timeout-seconds", defaultValue = "5")
    int redisTimeoutSeconds;

    @Inject
    RedisAPI redisAPI;

    @Override
    public String append(String stream, Map<String, String> fields) {
        List<String> args = new ArrayList<>(2 + fields.size() * 2);
        args.add(stream);
        args.add("*");
        fields.forEach((name, value) -> {
            args.add(name);
            args.add(value);
        });
        Response response = execute("XADD", stream, () -> redisAPI.xadd(args)
                .await().atMost(timeout()));
        if (response == null) {
            throw new LogStoreException("XADD returned no entry id for stream " + stream);
        }
        return response.toString();
    }

    @Override
    public List<StreamEntry> readGroup(String stream, String group, String consumer, int count, long blockMs, String startId) {
        List<String> args = new ArrayList<>();
        args.add("GROUP");
        args.add(group);
        args.add(consumer);
        args.add("COUNT");
        args.add(String.valueOf(count));
        boolean blocking = NEW_ENTRIES.equals(startId) && blockMs > 0;
        if (blocking) {
            args.add("BLOCK");
            args.add(String.valueOf(blockMs));
        }
        args.add("STREAMS");
        args.add(stream);
        args.add(startId);

        // Add extra buffer for BLOCK timeout + network round-trip
        Duration readTimeout = blocking ? Duration.ofMillis(blockMs).plus(timeout()) : timeout();
        Response resp = execute("XREADGROUP", stream, () -> redisAPI.xreadgroup(args)
                .await().atMost(readTimeout));
        if (resp == null) {
            return Collections.emptyList();
        }
        return parseXReadResponse(resp);
    }

    @Override
    public long ack(String stream, String group, String entryId) {
        Response resp = execute("XACK", stream, () -> redisAPI.xack(List.of(stream, group, entryId))
                .await().atMost(timeout()));
        return parseLong(resp, 0);
    }

    @Override
    public void createGroup(String stream, String group, String startId) {
        try {
            redisAPI.xgroup(List.of("CREATE", stream, group, startId, "MKSTREAM"))
                    .await().atMost(timeout());
            LOG.debugf("Created Redis Stream group: %s on %s", group, stream);
        } catch (Exception e) {
            if (hasErrorCode(e, "BUSYGROUP")) {
                throw new GroupAlreadyExistsException(stream, group);
            }
            throw new LogStoreException("XGROUP CREATE failed for " + stream + "/" + group, e);
        }
    }

    @Override
    public long deleteConsumer(String stream, String group, String consumer) {
        Response resp = execute("XGROUP DELCONSUMER", stream,
                () -> redisAPI.xgroup(List.of("DELCONSUMER", stream, group, consumer))
                        .await().atMost(timeout()));
        return parseLong(resp, 0);
    }

    @Override
    public long trim(String stream, long maxLen) {
        Response resp = execute("XTRIM", stream,
                () -> redisAPI.xtrim(List.of(stream, "MAXLEN", "~", String.valueOf(maxLen)))
                        .await().atMost(timeout()));
        return parseLong(resp, 0);
    }

    @Override
    public List<PendingEntry> pendingList(String stream, String group, int count) {
        Response resp = execute("XPENDING", stream,
                () -> redisAPI.xpending(List.of(stream, group, "-", "+", String.valueOf(count)))
                        .await().atMost(timeout()));
        if (resp == null) {
            return Collections.emptyList();
        }
        // Response structure: [[id, consumer, idle-ms, delivery-count], ...]
        List<PendingEntry> pending = new ArrayList<>(resp.size());
        for (int i = 0; i < resp.size(); i++) {
            Response row = resp.get(i);
            if (row == null || row.size() < 4) {
                continue;
            }
            pending.add(new PendingEntry(
                    row.get(0).toString(),
                    row.get(1).toString(),
                    parseLong(row.get(2), 0),
                    parseLong(row.get(3), 0)));
        }
        return pending;
    }

    @Override
    public List<String> keys() {
        Response resp = execute("KEYS", "*", () -> redisAPI.keys("*")
                .await().atMost(timeout()));
        if (resp == null) {
            return Collections.emptyList();
        }
        List<String> keys = new ArrayList<>(resp.size());
        for (int i = 0; i < resp.size(); i++) {
            keys.add(resp.get(i).toString());
        }
        return keys;
    }

    @Override
    public String typeOf(String key) {
        Response resp = execute("TYPE", key, () -> redisAPI.type(key)
                .await().atMost(timeout()));
        return resp != null ? resp.toString() : "none";
    }

    @Override
    public boolean expire(String stream, long seconds) {
        Response resp = execute("EXPIRE", stream, () -> redisAPI.expire(List.of(stream, String.valueOf(seconds)))
                .await().atMost(timeout()));
        return parseLong(resp, 0) == 1;
    }

    @Override
    public Optional<StreamInfo> streamInfo(String stream) {
        Response resp;
        try {
            resp = redisAPI.xinfo(List.of("STREAM", stream))
                    .await().atMost(timeout());
        } catch (Exception e) {
            if (hasErrorCode(e, "no such key")) {
                return Optional.empty();
            }
            throw new LogStoreException("XINFO STREAM failed for " + stream, e);
        }
        if (resp == null) {
            return Optional.empty();
        }
        Map<String, Response> info = new LinkedHashMap<>();
        for (int i = 0; i + 1 < resp.size(); i += 2) {
            info.put(resp.get(i).toString(), resp.get(i + 1));
        }
        return Optional.of(new StreamInfo(
                stream,
                parseLong(info.get("length"), 0),
                parseLong(info.get("groups"), 0),
                stringOrNull(info.get("last-generated-id")),
                entryIdOf(info.get("first-entry")),
                entryIdOf(info.get("last-entry"))));
    }

    @Override
    public StoreHealth healthCheck() {
        long start = System.currentTimeMillis();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("store", "redis");
        try {
            Response resp = redisAPI.ping(List.of())
                    .await().atMost(timeout());
            long latency = System.currentTimeMillis() - start;
            boolean healthy = resp != null && "PONG".equalsIgnoreCase(resp.toString());
            details.put("ping", resp != null ? resp.toString() : null);
            return new StoreHealth(healthy, latency, details);
        } catch (Exception e) {
            LOG.warnf(e, "Redis ping failed");
            details.put("error", e.getMessage());
            return new StoreHealth(false, System.currentTimeMillis() - start, details);
        }
    }

    private Duration timeout() {
        return Duration.ofSeconds(redisTimeoutSeconds);
    }

    private Response execute(String command, String key, RedisCall call) {
        try {
            return call.run();
        } catch (Exception e) {
            if (hasErrorCode(e, "NOGROUP")) {
                throw new NoSuchGroupException(command + " failed for " + key + ": no such stream or group", e);
            }
            throw new LogStoreException(command + " failed for " + key, e);
        }
    }

    private List<StreamEntry> parseXReadResponse(Response resp) {
        List<StreamEntry> entries = new ArrayList<>();
        // Response structure: [[stream, [[id, [field, value]...], ...]]]
        for (int i = 0; i < resp.size(); i++) {
            Response streamResp = resp.get(i);
            if (streamResp == null || streamResp.size() < 2) {
                continue;
            }
            Response messages = streamResp.get(1);
            if (messages == null) {
                continue;
            }
            for (int j = 0; j < messages.size(); j++) {
                Response message = messages.get(j);
                if (message == null || message.size() < 1) {
                    continue;
                }
                String id = message.get(0).toString();
                Response fields = message.size() > 1 ? message.get(1) : null;
                entries.add(new StreamEntry(id, parseFields(fields)));
            }
        }
        return entries;
    }

    private Map<String, String> parseFields(Response fields) {
        // Pending entries whose payload was trimmed come back with nil fields
        if (fields == null) {
            return Collections.emptyMap();
        }
        Map<String, String> parsed = new LinkedHashMap<>();
        for (int k = 0; k + 1 < fields.size(); k += 2) {
            Response fieldName = fields.get(k);
            Response value = fields.get(k + 1);
            if (fieldName != null && value != null) {
                parsed.put(fieldName.toString(), value.toString(StandardCharsets.UTF_8));
            }
        }
        return parsed;
    }

    private String entryIdOf(Response entry) {
        if (entry == null || entry.size() < 1) {
            return null;
        }
        return entry.get(0).toString();
    }

    private String stringOrNull(Response response) {
        return response != null ? response.toString() : null;
    }

    private long parseLong(Response response, long fallback) {
        if (response == null) {
            return fallback;
        }
        try {
            return Long.parseLong(response.toString());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static boolean hasErrorCode(Throwable error, String code) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(code)) {
                return true;
            }
        }
        return false;
    }

    @FunctionalInterface
    private interface RedisCall {
        Response run();
    }
}
