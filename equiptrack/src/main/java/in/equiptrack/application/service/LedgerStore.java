package in.equiptrack.application.service;

import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.domain.equipment.Equipment;
import in.equiptrack.domain.loan.Loan;
import in.equiptrack.util.LedgerJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owner of the Equipment + Loan consistency domain.
 *
 * PURPOSE:
 * Every mutation of equipment or loans runs inside {@link #write}, which holds the single
 * writer lock for the whole validate-then-mutate sequence. Reads use {@link #current()},
 * an immutable state published after each commit, and never lock.
 *
 * COMMIT SEQUENCE (under the writer lock):
 * 1. Run the operation against a {@link LedgerTransaction} (no side effects)
 * 2. Persist records and audit entries through {@link AuditedCommitter}
 * 3. Publish the new state, still inside the audit append
 * 4. Make the audit entries queryable
 *
 * Any exception before step 3 leaves the published state unchanged. Because state is
 * published before its entries, an unlocked reader that finds an audit entry always
 * finds the record it describes.
 */
public final class LedgerStore {
    private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

    static final String EQUIPMENT_PREFIX = "equipment/";
    static final String LOAN_PREFIX = "loan/";

    private final LedgerStorage storage;
    private final AuditedCommitter committer;
    private final ReentrantLock writerLock = new ReentrantLock();

    private volatile LedgerState state = LedgerState.empty();

    public LedgerStore(LedgerStorage storage, AuditTrail auditTrail) {
        this.storage = storage;
        this.committer = new AuditedCommitter(storage, auditTrail);
    }

    /**
     * Load persisted equipment and loans. Called once at startup.
     */
    public void load() {
        List<Equipment> equipment = LedgerJson.decodeAll(storage.readAll(EQUIPMENT_PREFIX), Equipment.class);
        List<Loan> loans = LedgerJson.decodeAll(storage.readAll(LOAN_PREFIX), Loan.class);
        writerLock.lock();
        try {
            this.state = LedgerState.of(equipment, loans);
        } finally {
            writerLock.unlock();
        }
        log.info("Ledger loaded: {} equipment, {} loans", equipment.size(), loans.size());
    }

    /**
     * Latest committed state. Safe to call from any thread without locking.
     */
    public LedgerState current() {
        return state;
    }

    /**
     * Run a mutation under the writer lock and commit it.
     *
     * @param operation validates and stages changes; may throw to abort
     * @return the operation's result
     */
    public <T> T write(Function<LedgerTransaction, T> operation) {
        writerLock.lock();
        try {
            LedgerTransaction tx = new LedgerTransaction(state);
            T result = operation.apply(tx);
            if (!tx.isEmpty()) {
                LedgerState next = tx.applyTo(state);
                committer.commit(tx.toBatch(), () -> state = next);
            }
            return result;
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Hold the writer lock while running {@code action}. Used to freeze the ledger briefly
     * for snapshot capture and restore.
     */
    public <T> T withWriterLock(Supplier<T> action) {
        writerLock.lock();
        try {
            return action.get();
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Publish a restored state. Caller must hold the writer lock and have already
     * written the same records to storage.
     */
    void replace(LedgerState restored) {
        if (!writerLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("replace requires the writer lock");
        }
        this.state = restored;
    }

    static String equipmentKey(String equipmentId) {
        return EQUIPMENT_PREFIX + equipmentId;
    }

    static String loanKey(String loanId) {
        return LOAN_PREFIX + loanId;
    }
}
