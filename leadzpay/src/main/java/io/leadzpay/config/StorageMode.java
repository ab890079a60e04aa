package io.leadzpay.config;

import java.util.Locale;

/**
 * Where connections and leads are stored.
 */
public enum StorageMode {
    POSTGRES,   // HikariCP pool against DB_URL
    MEMORY;     // Process-local maps; data is lost on restart

    public static StorageMode fromWire(String value) {
        try {
            return StorageMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: LEADZPAY_STORAGE must be postgres or memory, got '" + value + "'", e);
        }
    }
}
