package in.equiptrack.domain.equipment;

/**
 * Lifecycle status of an equipment item.
 *
 * Legal edges:
 * <pre>
 * AVAILABLE   -> LOANED, MAINTENANCE, RETIRED
 * LOANED      -> AVAILABLE, RETIRED
 * MAINTENANCE -> AVAILABLE, RETIRED
 * RETIRED     -> (terminal)
 * </pre>
 *
 * LOANED -> MAINTENANCE is reachable only as a return with inspection, which the
 * loan ledger performs as LOANED -> AVAILABLE -> MAINTENANCE in one commit.
 */
public enum EquipmentStatus {
    AVAILABLE,
    LOANED,
    MAINTENANCE,
    RETIRED;

    public boolean isTerminal() {
        return this == RETIRED;
    }

    /**
     * Whether a direct move from this status to {@code target} is legal.
     */
    public boolean canTransitionTo(EquipmentStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return switch (this) {
            case AVAILABLE -> target == LOANED || target == MAINTENANCE || target == RETIRED;
            case LOANED, MAINTENANCE -> target == AVAILABLE || target == RETIRED;
            case RETIRED -> false;
        };
    }
}
