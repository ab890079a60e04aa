package io.leadzpay.service.connection;

import java.util.Locale;

/**
 * Connection list filter.
 *
 * PENDING means "waiting on me": pending_buyer_review for buyers, pending_provider_accept
 * for providers.
 */
public enum ConnectionFilter {
    ALL,
    PENDING,
    ACTIVE;

    /**
     * Parse a query value; null or blank means ALL.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static ConnectionFilter fromWire(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return ConnectionFilter.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
