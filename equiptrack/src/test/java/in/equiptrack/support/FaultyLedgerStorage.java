package in.equiptrack.support;

import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.application.port.output.StorageUnavailableException;
import in.equiptrack.infrastructure.persistence.InMemoryLedgerStorage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory storage with switchable faults.
 *
 * Batch writes touching a key under {@link #failPrefix} fail while the remaining failure
 * count is positive. Snapshot writes can be made to fail or to block until released.
 */
public final class FaultyLedgerStorage implements LedgerStorage {

    private final InMemoryLedgerStorage delegate = new InMemoryLedgerStorage();
    private final AtomicInteger remainingFailures = new AtomicInteger();
    private final AtomicInteger batchWrites = new AtomicInteger();
    private volatile String failPrefix = "";
    private volatile boolean failSnapshots = false;
    private volatile CountDownLatch snapshotGate;
    private volatile boolean ignoreInterrupts = false;
    private final AtomicInteger snapshotDeletes = new AtomicInteger();

    /**
     * Fail the next {@code times} batches that write a key starting with {@code prefix}.
     */
    public void failBatches(String prefix, int times) {
        this.failPrefix = prefix;
        remainingFailures.set(times);
    }

    public void failSnapshots(boolean fail) {
        this.failSnapshots = fail;
    }

    /**
     * Block snapshot writes until {@link #releaseSnapshots()}.
     */
    public void blockSnapshots() {
        ignoreInterrupts = false;
        snapshotGate = new CountDownLatch(1);
    }

    /**
     * Block snapshot writes until released, then complete them even if the writer thread was
     * interrupted meanwhile. Models a write stuck in I/O that cancellation cannot stop.
     */
    public void blockSnapshotsIgnoringInterrupts() {
        ignoreInterrupts = true;
        snapshotGate = new CountDownLatch(1);
    }

    public int snapshotDeletes() {
        return snapshotDeletes.get();
    }

    public void releaseSnapshots() {
        CountDownLatch gate = snapshotGate;
        if (gate != null) {
            gate.countDown();
        }
    }

    public int batchWrites() {
        return batchWrites.get();
    }

    public int recordCount() {
        return delegate.size();
    }

    public InMemoryLedgerStorage delegate() {
        return delegate;
    }

    @Override
    public Optional<byte[]> atomicRead(String key) {
        return delegate.atomicRead(key);
    }

    @Override
    public void atomicWrite(String key, byte[] value) {
        atomicWriteAll(Map.of(key, value), List.of());
    }

    @Override
    public void atomicWriteAll(Map<String, byte[]> puts, Collection<String> deletes) {
        batchWrites.incrementAndGet();
        boolean matches = puts.keySet().stream().anyMatch(k -> k.startsWith(failPrefix));
        if (matches && remainingFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StorageUnavailableException("injected failure for " + failPrefix);
        }
        delegate.atomicWriteAll(puts, deletes);
    }

    @Override
    public Map<String, byte[]> readAll(String prefix) {
        return delegate.readAll(prefix);
    }

    @Override
    public void durableSnapshotWrite(String snapshotId, byte[] blob) {
        CountDownLatch gate = snapshotGate;
        if (gate != null) {
            awaitGate(gate);
        }
        if (failSnapshots) {
            throw new StorageUnavailableException("injected snapshot failure");
        }
        delegate.durableSnapshotWrite(snapshotId, blob);
    }

    private void awaitGate(CountDownLatch gate) {
        boolean interrupted = false;
        while (true) {
            try {
                gate.await();
                break;
            } catch (InterruptedException e) {
                if (!ignoreInterrupts) {
                    Thread.currentThread().interrupt();
                    throw new StorageUnavailableException("snapshot write interrupted", e);
                }
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public Optional<byte[]> readSnapshot(String snapshotId) {
        return delegate.readSnapshot(snapshotId);
    }

    @Override
    public List<String> listSnapshots() {
        return delegate.listSnapshots();
    }

    @Override
    public void deleteSnapshot(String snapshotId) {
        delegate.deleteSnapshot(snapshotId);
        snapshotDeletes.incrementAndGet();
    }
}
