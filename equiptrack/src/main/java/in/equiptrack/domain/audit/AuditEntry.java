package in.equiptrack.domain.audit;

import java.time.Instant;

/**
 * Immutable audit trail entry.
 *
 * {@code seq} is strictly increasing and timestamps never decrease in seq order,
 * so seq order and timestamp order agree.
 */
public record AuditEntry(
    long seq,
    Instant timestamp,
    String actorId,
    AuditAction action,
    EntityType entityType,
    String entityId,
    String beforeStatus,    // null for creations
    String afterStatus,
    String details
) {
    public static AuditEntry from(AuditDraft draft, long seq, Instant timestamp) {
        return new AuditEntry(seq, timestamp, draft.actorId(), draft.action(), draft.entityType(),
            draft.entityId(), draft.beforeStatus(), draft.afterStatus(), draft.details());
    }
}
