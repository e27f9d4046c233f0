package in.equiptrack.domain.audit;

/**
 * Kinds of operations recorded in the audit trail.
 */
public enum AuditAction {
    // Equipment
    EQUIPMENT_REGISTERED,
    EQUIPMENT_TRANSITIONED,
    EQUIPMENT_UPDATED,

    // Loans
    LOAN_ISSUED,
    LOAN_RETURNED,

    // Users
    USER_CREATED,
    USER_ROLE_CHANGED,
    USER_DEACTIVATED,
    USER_LOAN_LIMIT_CHANGED,
    USER_PASSWORD_CHANGED
}
