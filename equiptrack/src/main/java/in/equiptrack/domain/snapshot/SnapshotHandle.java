package in.equiptrack.domain.snapshot;

import java.time.Instant;

/**
 * Reference to a durably written snapshot.
 */
public record SnapshotHandle(
    String snapshotId,
    Instant capturedAt,
    String createdBy,
    int equipmentCount,
    int loanCount,
    int userCount,
    int auditCount,
    long sizeBytes
) {}
