package com.streambus.store;

import java.util.Objects;

/**
 * Stream entry id in the {@code <millis>-<sequence>} form used by Redis Streams.
 * Ordering is numeric on millis, then sequence.
 */
public final class StreamEntryId implements Comparable<StreamEntryId> {

    public static final StreamEntryId ZERO = new StreamEntryId(0, 0);

    private final long millis;
    private final long sequence;

    public StreamEntryId(long millis, long sequence) {
        if (millis < 0 || sequence < 0) {
            throw new IllegalArgumentException("Stream entry id parts must be non-negative");
        }
        this.millis = millis;
        this.sequence = sequence;
    }

    /**
     * Parses {@code 1700000000000-3}; a bare {@code 1700000000000} means sequence 0.
     */
    public static StreamEntryId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Stream entry id is required");
        }
        String trimmed = value.trim();
        int dash = trimmed.indexOf('-');
        try {
            if (dash < 0) {
                return new StreamEntryId(Long.parseLong(trimmed), 0);
            }
            return new StreamEntryId(
                    Long.parseLong(trimmed.substring(0, dash)),
                    Long.parseLong(trimmed.substring(dash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid stream entry id: " + value, e);
        }
    }

    /**
     * Next id after {@code last} for an append happening at {@code nowMillis}.
     * A clock that moved backwards keeps the last millis and bumps the sequence.
     */
    public static StreamEntryId next(StreamEntryId last, long nowMillis) {
        if (nowMillis > last.millis) {
            return new StreamEntryId(nowMillis, 0);
        }
        return new StreamEntryId(last.millis, last.sequence + 1);
    }

    public long getMillis() {
        return millis;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public int compareTo(StreamEntryId other) {
        int byMillis = Long.compare(millis, other.millis);
        return byMillis != 0 ? byMillis : Long.compare(sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamEntryId)) {
            return false;
        }
        StreamEntryId that = (StreamEntryId) o;
        return millis == that.millis && sequence == that.sequence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(millis, sequence);
    }

    @Override
    public String toString() {
        return millis + "-" + sequence;
    }
}
