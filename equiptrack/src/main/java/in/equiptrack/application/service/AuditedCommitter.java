package in.equiptrack.application.service;

import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.application.port.output.StorageUnavailableException;
import in.equiptrack.domain.audit.AuditEntry;
import in.equiptrack.domain.common.AuditWriteFailedException;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.common.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes a mutation's records and its audit entries as one unit.
 *
 * Order: records first, then audit. If the audit append fails the records are put back
 * to their previous versions and the failure is rethrown, so the ledger never holds a
 * change its audit trail does not describe. The caller's {@code publish} step runs once
 * both are durable and before the audit entries become queryable.
 */
final class AuditedCommitter {
    private static final Logger log = LoggerFactory.getLogger(AuditedCommitter.class);

    private final LedgerStorage storage;
    private final AuditTrail auditTrail;

    AuditedCommitter(LedgerStorage storage, AuditTrail auditTrail) {
        this.storage = storage;
        this.auditTrail = auditTrail;
    }

    /**
     * @throws LedgerException with STORAGE_UNAVAILABLE if the records cannot be written
     * @throws AuditWriteFailedException if the audit append fails; the records are rolled back
     */
    List<AuditEntry> commit(RecordBatch batch, Runnable publish) {
        try {
            storage.atomicWriteAll(batch.puts(), List.of());
        } catch (StorageUnavailableException e) {
            log.error("Record write failed ({} records): {}", batch.puts().size(), e.getMessage());
            throw new LedgerException(LedgerErrorCode.STORAGE_UNAVAILABLE, "record write failed", e);
        }

        try {
            return auditTrail.appendAll(batch.auditDrafts(), publish);
        } catch (AuditWriteFailedException e) {
            undo(batch, e);
            throw e;
        }
    }

    private void undo(RecordBatch batch, AuditWriteFailedException cause) {
        try {
            storage.atomicWriteAll(batch.undoPuts(), batch.undoDeletes());
            log.warn("Rolled back {} records after audit write failure", batch.puts().size());
        } catch (StorageUnavailableException undoError) {
            cause.addSuppressed(undoError);
            log.error("Rollback after audit failure also failed; storage may hold {} unaudited records: {}",
                batch.puts().size(), undoError.getMessage());
        }
    }
}
