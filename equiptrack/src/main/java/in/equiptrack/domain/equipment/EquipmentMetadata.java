package in.equiptrack.domain.equipment;

/**
 * Descriptive, editable attributes of an equipment item.
 */
public record EquipmentMetadata(
    String name,
    String category,
    String location,
    String notes
) {
    public static EquipmentMetadata of(String name, String category, String location) {
        return new EquipmentMetadata(name, category, location, null);
    }
}
