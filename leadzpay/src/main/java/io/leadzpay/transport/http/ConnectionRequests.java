package io.leadzpay.transport.http;

import io.leadzpay.domain.connection.ContractTerms;
import io.leadzpay.domain.lead.LeadStatus;

/**
 * Request bodies for the connection and lead endpoints.
 */
public final class ConnectionRequests {

    /**
     * POST /api/connections. Providers send buyerId; buyers send providerId and terms.
     */
    public record Create(String buyerId, String providerId, ContractTerms terms, String message) {}

    /**
     * PATCH /api/connections/{id}. Terms apply to set_terms and update_terms, reason to terminate.
     */
    public record Action(String action, ContractTerms terms, String reason) {}

    /**
     * PATCH /api/leads/{id}.
     */
    public record LeadStatusChange(LeadStatus status) {}

    private ConnectionRequests() {}
}
