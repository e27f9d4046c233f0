package in.equiptrack.application.port.output;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage engine boundary.
 *
 * Keys are slash-separated paths such as {@code equipment/EQ-1A2B3C4D}. Values are opaque bytes.
 * Every method either completes fully or throws {@link StorageUnavailableException}; partial
 * batches are never visible.
 */
public interface LedgerStorage {

    Optional<byte[]> atomicRead(String key);

    void atomicWrite(String key, byte[] value);

    /**
     * Apply puts and deletes as one all-or-nothing batch.
     */
    void atomicWriteAll(Map<String, byte[]> puts, Collection<String> deletes);

    /**
     * All records whose key starts with {@code prefix}, ordered by key.
     */
    Map<String, byte[]> readAll(String prefix);

    /**
     * Durably write a snapshot blob. Returns only once the blob is persisted.
     */
    void durableSnapshotWrite(String snapshotId, byte[] blob);

    Optional<byte[]> readSnapshot(String snapshotId);

    /**
     * Snapshot ids, oldest first.
     */
    List<String> listSnapshots();

    /**
     * Remove a snapshot. Removing an id that does not exist is a no-op.
     */
    void deleteSnapshot(String snapshotId);
}
