package in.equiptrack.domain.loan;

/**
 * Effective loan status. OVERDUE is derived from the clock and never stored.
 */
public enum LoanStatus {
    OPEN,
    OVERDUE,
    RETURNED;

    public boolean isActive() {
        return this != RETURNED;
    }
}
