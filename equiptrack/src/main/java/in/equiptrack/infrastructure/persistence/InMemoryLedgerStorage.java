package in.equiptrack.infrastructure.persistence;

import in.equiptrack.application.port.output.LedgerStorage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Volatile storage for tests and single-process demos. Nothing survives a restart.
 *
 * THREAD-SAFETY: all methods synchronize on the instance, so batches are atomic to readers.
 */
public final class InMemoryLedgerStorage implements LedgerStorage {

    private final TreeMap<String, byte[]> records = new TreeMap<>();
    private final LinkedHashMap<String, byte[]> snapshots = new LinkedHashMap<>();

    @Override
    public synchronized Optional<byte[]> atomicRead(String key) {
        byte[] value = records.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public synchronized void atomicWrite(String key, byte[] value) {
        records.put(key, value.clone());
    }

    @Override
    public synchronized void atomicWriteAll(Map<String, byte[]> puts, Collection<String> deletes) {
        for (String key : deletes) {
            records.remove(key);
        }
        for (Map.Entry<String, byte[]> e : puts.entrySet()) {
            records.put(e.getKey(), e.getValue().clone());
        }
    }

    @Override
    public synchronized Map<String, byte[]> readAll(String prefix) {
        Map<String, byte[]> result = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> e : records.tailMap(prefix, true).entrySet()) {
            if (!e.getKey().startsWith(prefix)) {
                break;
            }
            result.put(e.getKey(), e.getValue().clone());
        }
        return result;
    }

    @Override
    public synchronized void durableSnapshotWrite(String snapshotId, byte[] blob) {
        snapshots.put(snapshotId, blob.clone());
    }

    @Override
    public synchronized Optional<byte[]> readSnapshot(String snapshotId) {
        byte[] blob = snapshots.get(snapshotId);
        return blob == null ? Optional.empty() : Optional.of(blob.clone());
    }

    @Override
    public synchronized List<String> listSnapshots() {
        return new ArrayList<>(snapshots.keySet());
    }

    @Override
    public synchronized void deleteSnapshot(String snapshotId) {
        snapshots.remove(snapshotId);
    }

    public synchronized int size() {
        return records.size();
    }
}
