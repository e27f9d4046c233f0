package in.equiptrack.domain.user;

public enum UserStatus {
    ACTIVE,
    DEACTIVATED
}
