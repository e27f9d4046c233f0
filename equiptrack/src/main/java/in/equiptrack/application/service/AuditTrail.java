package in.equiptrack.application.service;

import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.application.port.output.StorageUnavailableException;
import in.equiptrack.domain.audit.AuditDraft;
import in.equiptrack.domain.audit.AuditEntry;
import in.equiptrack.domain.audit.AuditQuery;
import in.equiptrack.domain.common.AuditWriteFailedException;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;
import in.equiptrack.util.LedgerJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Append-only audit trail.
 *
 * PURPOSE:
 * Records one entry per state-changing operation. Entries are persisted before they
 * become visible; a failed write surfaces as {@link AuditWriteFailedException} and the
 * caller must treat its mutation as not committed.
 *
 * ORDERING:
 * Appends are serialized by the trail's own lock, independent of the ledger writer lock.
 * Sequence numbers are strictly increasing and timestamps are clamped so they never go
 * backwards, which makes seq order and timestamp order identical.
 *
 * THREAD-SAFETY:
 * Queries run without locking against a copy-on-write list.
 */
public final class AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    static final String KEY_PREFIX = "audit/";
    private static final int APPEND_ATTEMPTS = 2;

    private final LedgerStorage storage;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final ReentrantLock appendLock = new ReentrantLock();

    private volatile CopyOnWriteArrayList<AuditEntry> entries = new CopyOnWriteArrayList<>();

    // Guarded by appendLock
    private long lastSeq = 0;
    private Instant lastTimestamp = Instant.EPOCH;

    public AuditTrail(LedgerStorage storage, Clock clock, LedgerMetrics metrics) {
        this.storage = storage;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Load persisted entries. Called once at startup before any append.
     */
    public void load() {
        List<AuditEntry> loaded = LedgerJson.decodeAll(storage.readAll(KEY_PREFIX), AuditEntry.class);
        replaceAll(loaded);
        log.info("Audit trail loaded: {} entries, last seq {}", loaded.size(), lastSeq);
    }

    /**
     * Append one entry.
     *
     * @throws AuditWriteFailedException if storage rejects the write
     */
    public AuditEntry append(AuditDraft draft) {
        return appendAll(List.of(draft)).get(0);
    }

    /**
     * Append entries as one atomic storage batch. Either all become visible or none do.
     *
     * @throws AuditWriteFailedException if storage rejects the write after retrying
     */
    public List<AuditEntry> appendAll(List<AuditDraft> drafts) {
        return appendAll(drafts, () -> { });
    }

    /**
     * Append entries, running {@code onPersisted} once they are durable but before
     * {@link #query} can return them. Owners publish the state the entries describe from
     * this hook, so a reader that sees an entry also sees its record.
     * {@code onPersisted} does not run when the write fails.
     *
     * @throws AuditWriteFailedException if storage rejects the write after retrying
     */
    List<AuditEntry> appendAll(List<AuditDraft> drafts, Runnable onPersisted) {
        if (drafts.isEmpty()) {
            onPersisted.run();
            return List.of();
        }

        appendLock.lock();
        try {
            Instant now = clock.instant();
            Instant ts = now.isBefore(lastTimestamp) ? lastTimestamp : now;

            List<AuditEntry> pending = new ArrayList<>(drafts.size());
            Map<String, byte[]> puts = new LinkedHashMap<>();
            long seq = lastSeq;
            for (AuditDraft draft : drafts) {
                AuditEntry entry = AuditEntry.from(draft, ++seq, ts);
                pending.add(entry);
                puts.put(key(entry.seq()), LedgerJson.toBytes(entry));
            }

            write(puts, pending.size());
            onPersisted.run();

            entries.addAll(pending);
            lastSeq = seq;
            lastTimestamp = ts;
            metrics.recordAuditEntries(pending.size());
            return pending;
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Entries matching the filter, ordered by timestamp ascending (ties by seq).
     *
     * The stream is lazy and finite. Each call scans a fresh view, so re-running the
     * same query sees entries appended since the last call.
     */
    public Stream<AuditEntry> query(AuditQuery filter) {
        return entries.stream().filter(filter::matches);
    }

    /**
     * Immutable copy of every entry, for snapshots.
     */
    public List<AuditEntry> view() {
        return List.copyOf(entries);
    }

    public long latestSeq() {
        appendLock.lock();
        try {
            return lastSeq;
        } finally {
            appendLock.unlock();
        }
    }

    public int size() {
        return entries.size();
    }

    /**
     * Replace all in-memory entries. Storage must already hold exactly these entries.
     */
    void replaceAll(Collection<AuditEntry> restored) {
        appendLock.lock();
        try {
            List<AuditEntry> sorted = new ArrayList<>(restored);
            sorted.sort(Comparator.comparingLong(AuditEntry::seq));
            this.entries = new CopyOnWriteArrayList<>(sorted);
            if (sorted.isEmpty()) {
                lastSeq = 0;
                lastTimestamp = Instant.EPOCH;
            } else {
                AuditEntry last = sorted.get(sorted.size() - 1);
                lastSeq = last.seq();
                lastTimestamp = last.timestamp();
            }
        } finally {
            appendLock.unlock();
        }
    }

    static String key(long seq) {
        return String.format("%s%020d", KEY_PREFIX, seq);
    }

    private void write(Map<String, byte[]> puts, int count) {
        StorageUnavailableException last = null;
        for (int attempt = 1; attempt <= APPEND_ATTEMPTS; attempt++) {
            try {
                storage.atomicWriteAll(puts, List.of());
                return;
            } catch (StorageUnavailableException e) {
                last = e;
                log.warn("Audit write attempt {}/{} failed for {} entries: {}",
                    attempt, APPEND_ATTEMPTS, count, e.getMessage());
            }
        }
        log.error("Audit write failed for {} entries after {} attempts", count, APPEND_ATTEMPTS);
        throw new AuditWriteFailedException(count, last);
    }
}
