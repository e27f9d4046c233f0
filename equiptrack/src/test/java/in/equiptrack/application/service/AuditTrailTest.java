package in.equiptrack.application.service;

import in.equiptrack.domain.audit.AuditAction;
import in.equiptrack.domain.audit.AuditDraft;
import in.equiptrack.domain.audit.AuditEntry;
import in.equiptrack.domain.audit.AuditQuery;
import in.equiptrack.domain.audit.EntityType;
import in.equiptrack.domain.common.AuditWriteFailedException;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;
import in.equiptrack.support.FaultyLedgerStorage;
import in.equiptrack.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuditTrailTest {

    @Mock
    private LedgerMetrics metrics;

    private FaultyLedgerStorage storage;
    private MutableClock clock;
    private AuditTrail trail;

    @BeforeEach
    void setUp() {
        storage = new FaultyLedgerStorage();
        clock = MutableClock.startingAt("2026-03-02T08:00:00Z");
        trail = new AuditTrail(storage, clock, metrics);
    }

    @Test
    void append_assignsIncreasingSequenceNumbers() {
        AuditEntry first = trail.append(draft("EQ-1"));
        AuditEntry second = trail.append(draft("EQ-2"));

        assertEquals(1, first.seq());
        assertEquals(2, second.seq());
        assertEquals(2, trail.latestSeq());
        verify(metrics, times(2)).recordAuditEntries(1);
    }

    @Test
    void append_clampsTimestampsWhenClockGoesBackwards() {
        AuditEntry first = trail.append(draft("EQ-1"));
        clock.advance(Duration.ofMinutes(-5));

        AuditEntry second = trail.append(draft("EQ-2"));

        assertEquals(first.timestamp(), second.timestamp());
        assertTrue(second.seq() > first.seq());
    }

    @Test
    void appendAll_sharesOneTimestampAndOneBatch() {
        int batchesBefore = storage.batchWrites();

        List<AuditEntry> entries = trail.appendAll(List.of(draft("EQ-1"), draft("EQ-2"), draft("EQ-3")));

        assertEquals(3, entries.size());
        assertEquals(1, storage.batchWrites() - batchesBefore);
        assertEquals(1, entries.stream().map(AuditEntry::timestamp).distinct().count());
        verify(metrics).recordAuditEntries(3);
    }

    @Test
    void append_retriesOnceAfterTransientFailure() {
        storage.failBatches(AuditTrail.KEY_PREFIX, 1);

        AuditEntry entry = trail.append(draft("EQ-1"));

        assertEquals(1, entry.seq());
        assertEquals(1, trail.size());
    }

    @Test
    void append_failsAfterRetryAndLeavesNothingVisible() {
        trail.append(draft("EQ-1"));
        storage.failBatches(AuditTrail.KEY_PREFIX, 2);

        AuditWriteFailedException ex = assertThrows(AuditWriteFailedException.class,
            () -> trail.append(draft("EQ-2")));

        assertEquals(LedgerErrorCode.STORAGE_UNAVAILABLE, ex.getCode());
        assertTrue(ex.isAuditWrite());
        assertEquals(1, ex.getPendingEntries());
        assertEquals(1, trail.size());
        assertEquals(1, trail.latestSeq());
        assertEquals(1, storage.readAll(AuditTrail.KEY_PREFIX).size());
        verify(metrics, never()).recordAuditEntries(2);

        AuditEntry next = trail.append(draft("EQ-3"));
        assertEquals(2, next.seq());
    }

    @Test
    void load_resumesSequenceFromStorage() {
        trail.append(draft("EQ-1"));
        trail.append(draft("EQ-2"));

        AuditTrail reloaded = new AuditTrail(storage, clock, LedgerMetrics.NOOP);
        reloaded.load();

        assertEquals(2, reloaded.size());
        assertEquals(3, reloaded.append(draft("EQ-3")).seq());
    }

    @Test
    void query_filtersByEntityActorAndInclusiveRange() {
        Instant t0 = clock.instant();
        trail.append(draft("EQ-1"));
        clock.advance(Duration.ofMinutes(10));
        trail.append(new AuditDraft("U-OTHER", AuditAction.EQUIPMENT_UPDATED, EntityType.EQUIPMENT,
            "EQ-2", "AVAILABLE", "AVAILABLE", "name: a -> b"));
        clock.advance(Duration.ofMinutes(10));
        Instant t2 = clock.instant();
        trail.append(draft("EQ-1"));

        assertEquals(2, trail.query(AuditQuery.forEntity("EQ-1")).count());
        assertEquals(1, trail.query(AuditQuery.forActor("U-OTHER")).count());
        assertEquals(3, trail.query(AuditQuery.between(t0, t2)).count());
        assertEquals(1, trail.query(AuditQuery.between(t2, t2)).count());
        assertEquals(0, trail.query(AuditQuery.between(t2.plusSeconds(1), t2.plusSeconds(60))).count());
    }

    @Test
    void concurrentAppends_produceGapFreeSequence() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        trail.append(draft("EQ-X"));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<AuditEntry> all = trail.view();
        assertEquals(400, all.size());
        Set<Long> seqs = new HashSet<>();
        for (int i = 0; i < all.size(); i++) {
            assertEquals(i + 1, all.get(i).seq());
            seqs.add(all.get(i).seq());
            if (i > 0) {
                assertFalse(all.get(i).timestamp().isBefore(all.get(i - 1).timestamp()));
            }
        }
        assertEquals(400, seqs.size());
    }

    private static AuditDraft draft(String entityId) {
        return AuditDraft.of("U-ADMIN", AuditAction.EQUIPMENT_TRANSITIONED, EntityType.EQUIPMENT,
            entityId, "AVAILABLE", "MAINTENANCE");
    }
}
