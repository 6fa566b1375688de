package com.streambus.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry read from a stream: the store-assigned id and its field map.
 * <p>
 * Entries re-read from a pending list after the stream was trimmed carry an empty field map.
 */
public class StreamEntry {

    private final String id;
    private final Map<String, String> fields;

    public StreamEntry(String id, Map<String, String> fields) {
        this.id = id;
        this.fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String getId() {
        return id;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public String getField(String name) {
        return fields.get(name);
    }
}
