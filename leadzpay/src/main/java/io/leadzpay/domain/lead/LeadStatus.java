package io.leadzpay.domain.lead;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Lead status lifecycle.
 *
 * Flow: PENDING → CLAIMED → CONVERTED, with REJECTED / EXPIRED reachable from either
 * open state.
 */
public enum LeadStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("claimed") CLAIMED,
    @JsonProperty("converted") CONVERTED,
    @JsonProperty("rejected") REJECTED,
    @JsonProperty("expired") EXPIRED;

    public boolean canTransitionTo(LeadStatus next) {
        return switch (this) {
            case PENDING -> next == CLAIMED || next == REJECTED || next == EXPIRED;
            case CLAIMED -> next == CONVERTED || next == REJECTED || next == EXPIRED;
            case CONVERTED, REJECTED, EXPIRED -> false;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LeadStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Lead status is required");
        }
        return LeadStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
