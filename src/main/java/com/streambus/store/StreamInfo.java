package com.streambus.store;

/**
 * Summary of a stream as reported by {@code XINFO STREAM}.
 */
public class StreamInfo {

    private final String stream;
    private final long length;
    private final long groups;
    private final String lastGeneratedId;
    private final String firstEntryId;
    private final String lastEntryId;

    public StreamInfo(String stream, long length, long groups, String lastGeneratedId,
                      String firstEntryId, String lastEntryId) {
        this.stream = stream;
        this.length = length;
        this.groups = groups;
        this.lastGeneratedId = lastGeneratedId;
        this.firstEntryId = firstEntryId;
        this.lastEntryId = lastEntryId;
    }

    public String getStream() {
        return stream;
    }

    public long getLength() {
        return length;
    }

    public long getGroups() {
        return groups;
    }

    public String getLastGeneratedId() {
        return lastGeneratedId;
    }

    /** Null when the stream is empty. */
    public String getFirstEntryId() {
        return firstEntryId;
    }

    /** Null when the stream is empty. */
    public String getLastEntryId() {
        return lastEntryId;
    }
}
