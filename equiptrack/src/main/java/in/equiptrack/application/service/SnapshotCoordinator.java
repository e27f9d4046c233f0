package in.equiptrack.application.service;

import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.application.port.output.StorageUnavailableException;
import in.equiptrack.config.LedgerConfig;
import in.equiptrack.domain.audit.AuditEntry;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.common.LedgerException;
import in.equiptrack.domain.equipment.Equipment;
import in.equiptrack.domain.loan.Loan;
import in.equiptrack.domain.snapshot.SnapshotBundle;
import in.equiptrack.domain.snapshot.SnapshotHandle;
import in.equiptrack.domain.user.Permission;
import in.equiptrack.domain.user.User;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;
import in.equiptrack.security.SecureAuditLogger;
import in.equiptrack.util.LedgerJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot/Backup Coordinator.
 *
 * PURPOSE:
 * Captures a consistent point-in-time copy of equipment, loans, users and the audit trail,
 * writes it durably, and restores the ledger from such a copy.
 *
 * CAPTURE:
 * The ledger writer lock and then the identity lock are held only while the published
 * state references and the audit view are taken. Serialization and durable I/O run after
 * both locks are released, on a background writer, so issue/return latency is unaffected.
 *
 * RESTORE:
 * Under ledger, identity and audit locks (in that order) every persisted record is
 * rewritten in one atomic batch; only then are the in-memory views swapped. A restore
 * does not append to the audit trail.
 *
 * THREAD-SAFETY:
 * snapshot() and restore() are safe to call concurrently with each other and with
 * ledger mutations.
 */
public final class SnapshotCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SnapshotCoordinator.class);

    private static final DateTimeFormatter ID_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final LedgerStore ledgerStore;
    private final IdentityStore identity;
    private final AuditTrail auditTrail;
    private final LedgerStorage storage;
    private final LedgerConfig config;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final SecureAuditLogger security = new SecureAuditLogger("SnapshotCoordinator");

    private final AtomicInteger writerThreads = new AtomicInteger();
    private final ExecutorService writer = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "SnapshotWriter-" + writerThreads.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "SnapshotScheduler");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running = false;
    private ScheduledFuture<?> periodicTask;

    public SnapshotCoordinator(LedgerStore ledgerStore, IdentityStore identity, AuditTrail auditTrail,
                               LedgerStorage storage, LedgerConfig config, Clock clock, LedgerMetrics metrics) {
        this.ledgerStore = ledgerStore;
        this.identity = identity;
        this.auditTrail = auditTrail;
        this.storage = storage;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SNAPSHOT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Capture and durably write a snapshot, waiting at most the configured snapshot timeout.
     *
     * @throws LedgerException UNAUTHORIZED, or SNAPSHOT_FAILED on timeout or write failure
     */
    public SnapshotHandle snapshot(String actorId) {
        identity.require(actorId, Permission.CREATE_SNAPSHOT);
        return capture(actorId);
    }

    /**
     * Same as {@link #snapshot} but returns immediately.
     */
    public CompletableFuture<SnapshotHandle> snapshotAsync(String actorId) {
        identity.require(actorId, Permission.CREATE_SNAPSHOT);
        return CompletableFuture.supplyAsync(() -> capture(actorId), writer);
    }

    /**
     * Snapshot ids, oldest first.
     */
    public List<String> listSnapshots() {
        try {
            return storage.listSnapshots();
        } catch (StorageUnavailableException e) {
            throw new LedgerException(LedgerErrorCode.STORAGE_UNAVAILABLE, "cannot list snapshots", e);
        }
    }

    private SnapshotHandle capture(String actorId) {
        long startNanos = System.nanoTime();
        CapturedView view = ledgerStore.withWriterLock(() -> identity.withLock(() ->
            new CapturedView(ledgerStore.current(), List.copyOf(identity.view()), auditTrail.view())));

        Instant capturedAt = clock.instant();
        String snapshotId = newSnapshotId(capturedAt);
        SnapshotBundle bundle = new SnapshotBundle(SnapshotBundle.FORMAT, SnapshotBundle.SCHEMA_VERSION,
            snapshotId, capturedAt, actorId,
            List.copyOf(view.state().allEquipment()), List.copyOf(view.state().allLoans()),
            view.users(), view.audit());

        byte[] blob;
        try {
            blob = LedgerJson.toBytes(bundle);
        } catch (IllegalStateException e) {
            recordSnapshot(false, startNanos);
            throw new LedgerException(LedgerErrorCode.SNAPSHOT_FAILED, "serialization failed", e);
        }

        // Whichever side settles second (late writer or abandoning caller) discards the blob
        AtomicBoolean settled = new AtomicBoolean();
        Future<?> write = writer.submit(() -> {
            storage.durableSnapshotWrite(snapshotId, blob);
            if (!settled.compareAndSet(false, true)) {
                discardAbandoned(snapshotId);
            }
        });
        Duration timeout = config.snapshotTimeout();
        try {
            write.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(write, settled, snapshotId);
            recordSnapshot(false, startNanos);
            log.error("Snapshot {} timed out after {}ms", snapshotId, timeout.toMillis());
            throw new LedgerException(LedgerErrorCode.SNAPSHOT_FAILED, "timed out after " + timeout, e);
        } catch (ExecutionException e) {
            recordSnapshot(false, startNanos);
            log.error("Snapshot {} write failed: {}", snapshotId, e.getCause().getMessage());
            throw new LedgerException(LedgerErrorCode.SNAPSHOT_FAILED, "write failed", e.getCause());
        } catch (InterruptedException e) {
            abandon(write, settled, snapshotId);
            Thread.currentThread().interrupt();
            recordSnapshot(false, startNanos);
            throw new LedgerException(LedgerErrorCode.SNAPSHOT_FAILED, "interrupted", e);
        }

        recordSnapshot(true, startNanos);
        SnapshotHandle handle = bundle.toHandle(blob.length);
        log.info("✅ Snapshot {} written: {} equipment, {} loans, {} users, {} audit entries ({} bytes)",
            snapshotId, handle.equipmentCount(), handle.loanCount(), handle.userCount(),
            handle.auditCount(), handle.sizeBytes());
        return handle;
    }

    private void abandon(Future<?> write, AtomicBoolean settled, String snapshotId) {
        if (!settled.compareAndSet(false, true)) {
            discardAbandoned(snapshotId);
        }
        write.cancel(true);
    }

    /**
     * Remove a blob whose caller was already told the snapshot failed, so it never shows up
     * in {@link #listSnapshots()} or becomes restorable.
     */
    private void discardAbandoned(String snapshotId) {
        try {
            storage.deleteSnapshot(snapshotId);
            log.warn("Discarded snapshot {} that completed after its caller gave up", snapshotId);
        } catch (StorageUnavailableException e) {
            log.error("Could not discard abandoned snapshot {}; it may still be listed: {}",
                snapshotId, e.getMessage(), e);
        }
    }

    private void recordSnapshot(boolean success, long startNanos) {
        metrics.recordSnapshot(success, Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private static String newSnapshotId(Instant capturedAt) {
        return "backup_" + ID_FORMAT.format(capturedAt) + "_"
            + UUID.randomUUID().toString().substring(0, 6).toLowerCase(Locale.ROOT);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // RESTORE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Replace the live ledger, users and audit trail with a snapshot's contents.
     *
     * @throws LedgerException UNAUTHORIZED, NOT_FOUND, INCOMPATIBLE_SNAPSHOT or STORAGE_UNAVAILABLE;
     *                         on any failure the live state is unchanged
     */
    public SnapshotHandle restore(String snapshotId, String actorId) {
        identity.require(actorId, Permission.RESTORE_SNAPSHOT);
        try {
            SnapshotHandle handle = doRestore(snapshotId);
            metrics.recordRestore(true);
            security.logPrivilegedOperation(actorId, "RESTORE_SNAPSHOT", snapshotId);
            log.info("✅ Restored snapshot {}: {} equipment, {} loans, {} users, {} audit entries",
                snapshotId, handle.equipmentCount(), handle.loanCount(), handle.userCount(), handle.auditCount());
            return handle;
        } catch (LedgerException e) {
            metrics.recordRestore(false);
            security.logError("RESTORE_SNAPSHOT " + snapshotId, e.getMessage());
            throw e;
        }
    }

    private SnapshotHandle doRestore(String snapshotId) {
        byte[] blob;
        try {
            blob = storage.readSnapshot(snapshotId)
                .orElseThrow(() -> LedgerException.notFound("snapshot", snapshotId));
        } catch (StorageUnavailableException e) {
            throw new LedgerException(LedgerErrorCode.STORAGE_UNAVAILABLE, "cannot read snapshot " + snapshotId, e);
        }

        SnapshotBundle bundle;
        try {
            bundle = LedgerJson.fromBytes(blob, SnapshotBundle.class);
        } catch (IOException e) {
            throw new LedgerException(LedgerErrorCode.INCOMPATIBLE_SNAPSHOT, "unreadable snapshot " + snapshotId, e);
        }
        if (bundle == null || !bundle.isCompatible()) {
            throw new LedgerException(LedgerErrorCode.INCOMPATIBLE_SNAPSHOT,
                bundle == null ? snapshotId
                    : "format=" + bundle.format() + ", schemaVersion=" + bundle.schemaVersion());
        }
        LedgerState restored = LedgerState.of(bundle.equipment(), bundle.loans());

        ledgerStore.withWriterLock(() -> identity.withLock(() -> {
            Map<String, byte[]> puts = new LinkedHashMap<>();
            for (Equipment e : bundle.equipment()) {
                puts.put(LedgerStore.equipmentKey(e.equipmentId()), LedgerJson.toBytes(e));
            }
            for (Loan l : bundle.loans()) {
                puts.put(LedgerStore.loanKey(l.loanId()), LedgerJson.toBytes(l));
            }
            for (User u : bundle.users()) {
                puts.put(IdentityStore.key(u.userId()), LedgerJson.toBytes(u));
            }
            for (AuditEntry a : bundle.audit()) {
                puts.put(AuditTrail.key(a.seq()), LedgerJson.toBytes(a));
            }

            try {
                List<String> deletes = staleKeys(puts.keySet());
                storage.atomicWriteAll(puts, deletes);
                log.info("Restore batch written: {} records, {} removed", puts.size(), deletes.size());
            } catch (StorageUnavailableException e) {
                throw new LedgerException(LedgerErrorCode.STORAGE_UNAVAILABLE, "restore write failed", e);
            }

            ledgerStore.replace(restored);
            identity.replaceUsers(bundle.users());
            auditTrail.replaceAll(bundle.audit());
            return null;
        }));
        return bundle.toHandle(blob.length);
    }

    private List<String> staleKeys(Set<String> keep) {
        Set<String> existing = new HashSet<>();
        for (String prefix : List.of(LedgerStore.EQUIPMENT_PREFIX, LedgerStore.LOAN_PREFIX,
                IdentityStore.KEY_PREFIX, AuditTrail.KEY_PREFIX)) {
            existing.addAll(storage.readAll(prefix).keySet());
        }
        existing.removeAll(keep);
        return new ArrayList<>(existing);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PERIODIC BACKUP
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Start periodic snapshots when an interval is configured.
     */
    public synchronized void start() {
        Duration interval = config.autoSnapshotInterval();
        if (running || interval.isZero()) {
            return;
        }
        running = true;
        periodicTask = scheduler.scheduleWithFixedDelay(this::periodicSnapshot,
            interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Periodic snapshots every {} min", interval.toMinutes());
    }

    /**
     * Stop periodic snapshots and release background threads.
     */
    public synchronized void stop() {
        running = false;
        if (periodicTask != null) {
            periodicTask.cancel(false);
        }
        scheduler.shutdown();
        writer.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!writer.awaitTermination(config.snapshotTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void periodicSnapshot() {
        try {
            capture(IdentityStore.SYSTEM_ACTOR);
        } catch (LedgerException e) {
            // Keep the schedule alive; the failure is already counted.
            log.error("Periodic snapshot failed: {}", e.getMessage(), e);
        }
    }

    private record CapturedView(LedgerState state, List<User> users, List<AuditEntry> audit) {}
}
