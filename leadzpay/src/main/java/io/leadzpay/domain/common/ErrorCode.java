package io.leadzpay.domain.common;

import java.util.Locale;

/**
 * Stable error codes returned to API clients in the {"error": ...} field.
 */
public enum ErrorCode {
    INVALID_TRANSITION,
    ACCESS_DENIED,
    CONNECTION_NOT_FOUND,
    LEAD_NOT_FOUND,
    CARRIER_NOT_FOUND,
    DUPLICATE_CONNECTION,
    INVALID_TERMS,
    CONCURRENT_UPDATE,
    EXCLUSIVITY_CONFLICT,
    INVALID_LEAD_TRANSITION,
    INVALID_REQUEST,
    UNAUTHENTICATED,
    INTERNAL_ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
