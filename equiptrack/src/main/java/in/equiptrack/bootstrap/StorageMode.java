package in.equiptrack.bootstrap;

import java.util.Locale;

/**
 * Storage engine selected by {@code STORAGE_MODE}.
 */
public enum StorageMode {
    MEMORY,
    FILE,
    POSTGRES;

    /**
     * @throws IllegalStateException for unknown values
     */
    public static StorageMode parse(String value) {
        if (value == null || value.isBlank()) {
            return MEMORY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown STORAGE_MODE: " + value + " (expected MEMORY, FILE or POSTGRES)", e);
        }
    }
}
