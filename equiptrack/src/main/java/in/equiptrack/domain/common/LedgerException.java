package in.equiptrack.domain.common;

/**
 * Exception thrown when a ledger operation is rejected or cannot complete.
 *
 * The error code is the stable, machine-readable part. The message adds context
 * such as the offending identifier.
 */
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    public LedgerException(LedgerErrorCode code) {
        super(code.getMessage());
        this.code = code;
    }

    public LedgerException(LedgerErrorCode code, String detail) {
        super(code.getMessage() + ": " + detail);
        this.code = code;
    }

    public LedgerException(LedgerErrorCode code, String detail, Throwable cause) {
        super(code.getMessage() + ": " + detail, cause);
        this.code = code;
    }

    public LedgerErrorCode getCode() {
        return code;
    }

    /**
     * True when the failure happened while persisting audit entries.
     */
    public boolean isAuditWrite() {
        return false;
    }

    public static LedgerException notFound(String entityType, String id) {
        return new LedgerException(LedgerErrorCode.NOT_FOUND, entityType + " " + id);
    }

    public static LedgerException invalidInput(String detail) {
        return new LedgerException(LedgerErrorCode.INVALID_INPUT, detail);
    }
}
