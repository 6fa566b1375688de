package com.streambus.store;

/**
 * Raised by {@link LogStore#createGroup} when the consumer group is already present
 * (Redis {@code BUSYGROUP}).
 */
public class GroupAlreadyExistsException extends LogStoreException {

    private final String stream;
    private final String group;

    public GroupAlreadyExistsException(String stream, String group) {
        super("Consumer group " + group + " already exists on stream " + stream);
        this.stream = stream;
        this.group = group;
    }

    public String getStream() {
        return stream;
    }

    public String getGroup() {
        return group;
    }
}
