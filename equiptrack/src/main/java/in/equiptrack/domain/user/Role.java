package in.equiptrack.domain.user;

/**
 * Closed set of roles. Each user holds exactly one.
 */
public enum Role {
    ADMINISTRATOR,
    SUPERVISOR,
    TECHNICIAN
}
