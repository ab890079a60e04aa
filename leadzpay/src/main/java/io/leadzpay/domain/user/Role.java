package io.leadzpay.domain.user;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Marketplace capability of an authenticated user.
 */
public enum Role {
    @JsonProperty("provider") PROVIDER,
    @JsonProperty("buyer") BUYER,
    @JsonProperty("admin") ADMIN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire value such as "buyer" (case-insensitive).
     *
     * @throws IllegalArgumentException for unknown roles
     */
    public static Role fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role is required");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
