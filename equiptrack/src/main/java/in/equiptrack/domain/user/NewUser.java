package in.equiptrack.domain.user;

/**
 * Request to create a user. The secret is hashed on receipt and never stored.
 */
public record NewUser(
    String username,
    String displayName,
    String secret,
    Role role,
    Integer loanLimit,
    String email,
    String phone,
    String department
) {
    public static NewUser of(String username, String displayName, String secret, Role role) {
        return new NewUser(username, displayName, secret, role, null, null, null, null);
    }

    @Override
    public String toString() {
        return "NewUser[username=" + username + ", role=" + role + ", secret=****]";
    }
}
