package in.equiptrack.domain.user;

import java.util.EnumSet;
import java.util.Set;

/**
 * Capability table: which roles may perform which operation.
 *
 * ADMINISTRATOR holds every capability. The other roles get the subsets below.
 */
public enum Permission {
    VIEW_INVENTORY(Role.SUPERVISOR, Role.TECHNICIAN),
    VIEW_REPORTS(Role.SUPERVISOR, Role.TECHNICIAN),
    ISSUE_LOAN(Role.SUPERVISOR),
    RETURN_LOAN(Role.SUPERVISOR),
    RECORD_MAINTENANCE(Role.TECHNICIAN),
    REGISTER_EQUIPMENT,
    EDIT_EQUIPMENT,
    RETIRE_EQUIPMENT,
    MANAGE_USERS,
    CREATE_SNAPSHOT,
    RESTORE_SNAPSHOT;

    private final Set<Role> roles;

    Permission(Role... nonAdminRoles) {
        EnumSet<Role> set = EnumSet.of(Role.ADMINISTRATOR);
        for (Role r : nonAdminRoles) {
            set.add(r);
        }
        this.roles = Set.copyOf(set);
    }

    public Set<Role> roles() {
        return roles;
    }

    public boolean grantedTo(Role role) {
        return role != null && roles.contains(role);
    }
}
