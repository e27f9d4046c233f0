package in.equiptrack.domain.audit;

import java.time.Instant;

/**
 * Audit trail filter. Null fields match everything; the time range is inclusive.
 */
public record AuditQuery(
    String entityId,
    String actorId,
    Instant from,
    Instant to
) {
    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null);
    }

    public static AuditQuery forEntity(String entityId) {
        return new AuditQuery(entityId, null, null, null);
    }

    public static AuditQuery forActor(String actorId) {
        return new AuditQuery(null, actorId, null, null);
    }

    public static AuditQuery between(Instant from, Instant to) {
        return new AuditQuery(null, null, from, to);
    }

    public boolean matches(AuditEntry entry) {
        if (entityId != null && !entityId.equals(entry.entityId())) {
            return false;
        }
        if (actorId != null && !actorId.equals(entry.actorId())) {
            return false;
        }
        if (from != null && entry.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || !entry.timestamp().isAfter(to);
    }
}
