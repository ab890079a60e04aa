package io.leadzpay.domain.connection;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.leadzpay.domain.user.Role;

import java.util.Locale;

/**
 * Actions on an existing connection, with the party allowed to take each one and the
 * status it must be taken from.
 *
 * A null required role means either party of the connection.
 */
public enum ConnectionAction {
    @JsonProperty("set_terms") SET_TERMS(Role.BUYER, ConnectionStatus.PENDING_BUYER_REVIEW),
    @JsonProperty("reject") REJECT(Role.BUYER, ConnectionStatus.PENDING_BUYER_REVIEW),
    @JsonProperty("accept") ACCEPT(Role.PROVIDER, ConnectionStatus.PENDING_PROVIDER_ACCEPT),
    @JsonProperty("decline") DECLINE(Role.PROVIDER, ConnectionStatus.PENDING_PROVIDER_ACCEPT),
    @JsonProperty("terminate") TERMINATE(null, ConnectionStatus.ACTIVE),
    @JsonProperty("update_terms") UPDATE_TERMS(Role.BUYER, ConnectionStatus.ACTIVE),
    @JsonProperty("submit_lead") SUBMIT_LEAD(Role.PROVIDER, ConnectionStatus.ACTIVE);

    private final Role requiredRole;
    private final ConnectionStatus requiredStatus;

    ConnectionAction(Role requiredRole, ConnectionStatus requiredStatus) {
        this.requiredRole = requiredRole;
        this.requiredStatus = requiredStatus;
    }

    public Role requiredRole() {
        return requiredRole;
    }

    public boolean allowedFrom(ConnectionStatus status) {
        return status == requiredStatus;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for unknown action names
     */
    public static ConnectionAction fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Action is required");
        }
        return ConnectionAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
