package ch.doodleduel.roomcore.repository;

import java.util.Map;
import java.util.Optional;

/**
 * Contract of the shared record store every client talks to.
 *
 * <p>Keys are slash separated paths ({@code rooms/ABC123}). Records are JSON-like trees of
 * {@code Map<String, Object>}, {@code String}, {@code Number} and {@code Boolean}.
 * There are no multi-key transactions: a single {@link #patch} is the largest atomic write.
 *
 * <p>Implementations throw {@code TransientStoreException} when the backend is unreachable.
 */
public interface RoomStore {

    /**
     * Writes a complete new record.
     *
     * @param key record key
     * @param record full record
     * @throws RecordAlreadyExistsException if a record already exists under {@code key}
     */
    void create(String key, Map<String, Object> record);

    /**
     * Merges fields into an existing record. Field names may be relative paths
     * ({@code players/p1/totalScore}); a {@code null} value removes the field.
     *
     * @param key record key
     * @param partialFields fields to merge
     * @throws RecordNotFoundException if no record exists under {@code key}; patch creates nothing
     */
    void patch(String key, Map<String, Object> partialFields);

    /**
     * Subscribes to a key. The listener receives the current value right away and then the full
     * current value after every change at or beneath the key ({@code null} once it is deleted).
     *
     * @param keyPrefix key to watch
     * @param listener receives full snapshots
     * @return handle that stops the pushes
     */
    Subscription subscribe(String keyPrefix, SnapshotListener listener);

    /**
     * Deletes a record and everything beneath it. Deleting an absent key succeeds.
     *
     * @param key record key
     */
    void delete(String key);

    /**
     * Point-in-time read.
     *
     * @param key record key
     * @return the record, empty if absent
     */
    Optional<Map<String, Object>> readOnce(String key);

    @FunctionalInterface
    interface SnapshotListener {
        void onSnapshot(Map<String, Object> value);
    }

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
