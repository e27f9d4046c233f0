package in.equiptrack.domain.common;

/**
 * Error codes for ledger, registry, identity and snapshot operations.
 */
public enum LedgerErrorCode {
    // Lookup
    NOT_FOUND("Entity not found"),

    // Registry
    DUPLICATE_CODE("Equipment code already assigned"),
    INVALID_TRANSITION("Status transition not allowed"),

    // Identity
    UNAUTHORIZED("Actor lacks the required capability"),
    AUTH_FAILED("Invalid username or password"),

    // Loans
    EQUIPMENT_UNAVAILABLE("Equipment is not available for loan"),
    LIMIT_EXCEEDED("Supervisor loan limit reached"),
    ALREADY_RETURNED("Loan already returned"),

    // Storage and backup
    STORAGE_UNAVAILABLE("Storage engine unavailable"),
    SNAPSHOT_FAILED("Snapshot could not be written"),
    INCOMPATIBLE_SNAPSHOT("Snapshot is unreadable or has an incompatible schema"),

    // Input
    INVALID_INPUT("Invalid input");

    private final String message;

    LedgerErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
