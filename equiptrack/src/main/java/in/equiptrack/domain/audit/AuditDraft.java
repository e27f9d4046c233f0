package in.equiptrack.domain.audit;

/**
 * An audit entry before the trail assigns its sequence number and timestamp.
 */
public record AuditDraft(
    String actorId,
    AuditAction action,
    EntityType entityType,
    String entityId,
    String beforeStatus,
    String afterStatus,
    String details
) {
    public static AuditDraft of(String actorId, AuditAction action, EntityType entityType, String entityId,
                                String beforeStatus, String afterStatus) {
        return new AuditDraft(actorId, action, entityType, entityId, beforeStatus, afterStatus, null);
    }

    public AuditDraft withDetails(String newDetails) {
        return new AuditDraft(actorId, action, entityType, entityId, beforeStatus, afterStatus, newDetails);
    }
}
