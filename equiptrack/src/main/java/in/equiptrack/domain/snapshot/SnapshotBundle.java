package in.equiptrack.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnore;
import in.equiptrack.domain.audit.AuditEntry;
import in.equiptrack.domain.equipment.Equipment;
import in.equiptrack.domain.loan.Loan;
import in.equiptrack.domain.user.User;

import java.time.Instant;
import java.util.List;

/**
 * Serialized form of a full ledger snapshot.
 *
 * {@code format} and {@code schemaVersion} are checked on restore; anything else is rejected
 * as incompatible.
 */
public record SnapshotBundle(
    String format,
    int schemaVersion,
    String snapshotId,
    Instant capturedAt,
    String createdBy,
    List<Equipment> equipment,
    List<Loan> loans,
    List<User> users,
    List<AuditEntry> audit
) {
    public static final String FORMAT = "equiptrack-ledger";
    public static final int SCHEMA_VERSION = 1;

    @JsonIgnore
    public boolean isCompatible() {
        return FORMAT.equals(format) && schemaVersion == SCHEMA_VERSION
            && equipment != null && loans != null && users != null && audit != null;
    }

    public SnapshotHandle toHandle(long sizeBytes) {
        return new SnapshotHandle(snapshotId, capturedAt, createdBy,
            equipment.size(), loans.size(), users.size(), audit.size(), sizeBytes);
    }
}
