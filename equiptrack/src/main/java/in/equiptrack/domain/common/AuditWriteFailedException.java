package in.equiptrack.domain.common;

/**
 * Raised when the audit trail could not persist entries for a mutation.
 *
 * The mutation that produced the entries is not committed.
 */
public class AuditWriteFailedException extends LedgerException {

    private final int pendingEntries;

    public AuditWriteFailedException(int pendingEntries, Throwable cause) {
        super(LedgerErrorCode.STORAGE_UNAVAILABLE,
            "audit write failed for " + pendingEntries + " entries, operation not committed", cause);
        this.pendingEntries = pendingEntries;
    }

    public int getPendingEntries() {
        return pendingEntries;
    }

    @Override
    public boolean isAuditWrite() {
        return true;
    }
}
