package in.equiptrack.domain.stats;

/**
 * Per-supervisor loan usage.
 */
public record SupervisorLoanSummary(
    String supervisorId,
    String username,
    String displayName,
    String department,
    int openLoans,
    int overdueLoans,
    int loanLimit,
    int remaining
) {}
