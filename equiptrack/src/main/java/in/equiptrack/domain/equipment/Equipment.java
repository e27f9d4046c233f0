package in.equiptrack.domain.equipment;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Equipment item tracked by the registry.
 *
 * The code is the value encoded in the item's QR label. It is unique and never changes
 * after registration. Equipment is never deleted: retirement is the end of its life.
 */
public record Equipment(
    String equipmentId,
    String code,
    String name,
    String category,
    String location,
    String notes,
    EquipmentStatus status,
    Instant createdAt,
    Instant updatedAt
) {
    public static Equipment register(String equipmentId, String code, EquipmentMetadata metadata, Instant now) {
        return new Equipment(equipmentId, code, metadata.name(), metadata.category(),
            metadata.location(), metadata.notes(), EquipmentStatus.AVAILABLE, now, now);
    }

    public EquipmentMetadata metadata() {
        return new EquipmentMetadata(name, category, location, notes);
    }

    public Equipment withStatus(EquipmentStatus newStatus, Instant now) {
        return new Equipment(equipmentId, code, name, category, location, notes, newStatus, createdAt, now);
    }

    public Equipment withLocation(String newLocation, Instant now) {
        return new Equipment(equipmentId, code, name, category, newLocation, notes, status, createdAt, now);
    }

    public Equipment withMetadata(EquipmentMetadata metadata, Instant now) {
        return new Equipment(equipmentId, code, metadata.name(), metadata.category(),
            metadata.location(), metadata.notes(), status, createdAt, now);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status == EquipmentStatus.AVAILABLE;
    }
}
