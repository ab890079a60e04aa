package io.leadzpay.util;

import java.math.BigDecimal;

/**
 * Environment variable utilities.
 *
 * Lookup order: environment variable, then system property, then the default.
 * Values that are present but unparseable fail fast with IllegalStateException.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    public static BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + key + " must be a number, got '" + value + "'", e);
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private Env() {}
}
