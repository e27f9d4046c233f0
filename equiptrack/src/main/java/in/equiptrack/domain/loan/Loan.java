package in.equiptrack.domain.loan;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A loan of one equipment item to one supervisor.
 *
 * The only stored state is whether {@code returnedAt} is set. Loans are never deleted.
 */
public record Loan(
    String loanId,
    String equipmentId,
    String supervisorId,
    Instant issuedAt,
    Instant dueAt,
    Instant returnedAt,     // null while open
    String issuedBy,
    String returnedBy,      // null while open
    String location,        // where the equipment was deployed
    String notes
) {
    @JsonIgnore
    public boolean isReturned() {
        return returnedAt != null;
    }

    /**
     * Effective status at {@code now}. A loan is overdue once now is strictly after dueAt.
     */
    public LoanStatus effectiveStatus(Instant now) {
        if (returnedAt != null) {
            return LoanStatus.RETURNED;
        }
        return now.isAfter(dueAt) ? LoanStatus.OVERDUE : LoanStatus.OPEN;
    }

    public Loan returned(Instant at, String actorId) {
        Instant closedAt = at.isBefore(issuedAt) ? issuedAt : at;
        return new Loan(loanId, equipmentId, supervisorId, issuedAt, dueAt, closedAt,
            issuedBy, actorId, location, notes);
    }
}
