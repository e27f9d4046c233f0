package in.equiptrack.domain.user;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * User entity.
 *
 * The credential hash is opaque to the domain. Contact fields are optional and
 * mainly used for supervisors.
 */
public record User(
    String userId,
    String username,
    String displayName,
    String credentialHash,
    Role role,
    UserStatus status,
    Integer loanLimit,      // null = configured default; only meaningful for SUPERVISOR
    String email,
    String phone,
    String department,
    Instant createdAt,
    Instant updatedAt
) {
    @JsonIgnore
    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isAdmin() {
        return role == Role.ADMINISTRATOR;
    }

    @JsonIgnore
    public boolean isSupervisor() {
        return role == Role.SUPERVISOR;
    }

    /**
     * Loan limit after applying the configured default.
     */
    public int effectiveLoanLimit(int defaultLimit) {
        return loanLimit != null ? loanLimit : defaultLimit;
    }

    public User withRole(Role newRole, Instant now) {
        return new User(userId, username, displayName, credentialHash, newRole, status,
            loanLimit, email, phone, department, createdAt, now);
    }

    public User withStatus(UserStatus newStatus, Instant now) {
        return new User(userId, username, displayName, credentialHash, role, newStatus,
            loanLimit, email, phone, department, createdAt, now);
    }

    public User withLoanLimit(Integer newLimit, Instant now) {
        return new User(userId, username, displayName, credentialHash, role, status,
            newLimit, email, phone, department, createdAt, now);
    }

    public User withCredentialHash(String newHash, Instant now) {
        return new User(userId, username, displayName, newHash, role, status,
            loanLimit, email, phone, department, createdAt, now);
    }
}
