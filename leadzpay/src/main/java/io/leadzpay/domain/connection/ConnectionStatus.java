package io.leadzpay.domain.connection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Connection lifecycle.
 *
 * Flow: PENDING_BUYER_REVIEW → PENDING_PROVIDER_ACCEPT → ACTIVE → TERMINATED
 * (or REJECTED_BY_BUYER / DECLINED_BY_PROVIDER from the pending states).
 * Buyer invitations start at PENDING_PROVIDER_ACCEPT.
 */
public enum ConnectionStatus {
    @JsonProperty("pending_buyer_review") PENDING_BUYER_REVIEW,
    @JsonProperty("pending_provider_accept") PENDING_PROVIDER_ACCEPT,
    @JsonProperty("active") ACTIVE,
    @JsonProperty("declined_by_provider") DECLINED_BY_PROVIDER,
    @JsonProperty("rejected_by_buyer") REJECTED_BY_BUYER,
    @JsonProperty("terminated") TERMINATED;

    public boolean isTerminal() {
        return this == DECLINED_BY_PROVIDER || this == REJECTED_BY_BUYER || this == TERMINATED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConnectionStatus fromWire(String value) {
        return ConnectionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
