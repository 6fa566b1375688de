package com.streambus.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only log substrate with consumer groups.
 * <p>
 * Every method reports store failures as {@link LogStoreException}.
 */
public interface LogStore {

    /** Read position for entries never delivered to the group. */
    String NEW_ENTRIES = ">";

    /** Group start position covering the whole stream, and the start of a consumer's own pending list. */
    String FROM_BEGINNING = "0";

    /** Group start position covering only entries appended after group creation. */
    String ONLY_NEW = "$";

    /**
     * Appends an entry, creating the stream if needed.
     * @return store-assigned entry id
     */
    String append(String stream, Map<String, String> fields);

    /**
     * Reads up to {@code count} entries for a consumer of a group.
     * <p>
     * With {@link #NEW_ENTRIES} returns never-delivered entries, waiting up to {@code blockMs}
     * (no wait when {@code blockMs <= 0}); any other id returns the consumer's own pending
     * entries after that id without waiting.
     */
    List<StreamEntry> readGroup(String stream, String group, String consumer, int count, long blockMs, String startId);

    /**
     * Acknowledges a processed entry.
     * @return number of entries removed from the pending list (0 or 1)
     */
    long ack(String stream, String group, String entryId);

    /**
     * Creates a consumer group at {@code startId}, creating the stream if absent.
     * @throws GroupAlreadyExistsException if the group already exists
     */
    void createGroup(String stream, String group, String startId);

    /**
     * Removes a consumer from a group, dropping its pending entries.
     * @return number of pending entries the consumer held
     */
    long deleteConsumer(String stream, String group, String consumer);

    /**
     * Approximately trims the stream down to {@code maxLen} entries.
     * @return number of entries removed
     */
    long trim(String stream, long maxLen);

    /**
     * Lists up to {@code count} pending entries of a group, oldest first.
     */
    List<PendingEntry> pendingList(String stream, String group, int count);

    /**
     * Every key held by the store, whatever its type.
     */
    List<String> keys();

    /**
     * Store type of a key ({@code stream}, {@code string}, ...) or {@code none}.
     */
    String typeOf(String key);

    /**
     * Expires the whole stream after {@code seconds}.
     * @return false if the stream does not exist
     */
    boolean expire(String stream, long seconds);

    /**
     * Describes a stream, empty when it does not exist.
     */
    Optional<StreamInfo> streamInfo(String stream);

    StoreHealth healthCheck();
}
