package in.equiptrack.domain.equipment;

import java.util.Locale;

/**
 * Inventory filter. Null fields match everything.
 *
 * @param status   exact status
 * @param category exact category, case-insensitive
 * @param text     substring of id, code, name or location, case-insensitive
 */
public record EquipmentFilter(EquipmentStatus status, String category, String text) {

    public static EquipmentFilter all() {
        return new EquipmentFilter(null, null, null);
    }

    public static EquipmentFilter byStatus(EquipmentStatus status) {
        return new EquipmentFilter(status, null, null);
    }

    public boolean matches(Equipment e) {
        if (status != null && e.status() != status) {
            return false;
        }
        if (category != null && !category.isBlank() && !category.equalsIgnoreCase(e.category())) {
            return false;
        }
        if (text != null && !text.isBlank()) {
            String needle = text.toLowerCase(Locale.ROOT);
            return contains(e.equipmentId(), needle)
                || contains(e.code(), needle)
                || contains(e.name(), needle)
                || contains(e.location(), needle);
        }
        return true;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
