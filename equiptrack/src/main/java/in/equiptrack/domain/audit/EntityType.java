package in.equiptrack.domain.audit;

public enum EntityType {
    EQUIPMENT,
    LOAN,
    USER
}
