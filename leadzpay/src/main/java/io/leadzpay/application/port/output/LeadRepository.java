package io.leadzpay.application.port.output;

import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.lead.Lead;
import io.leadzpay.domain.lead.LeadStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable lead history. Cap windows are counted from it directly.
 */
public interface LeadRepository {
    Optional<Lead> findById(String leadId);

    List<Lead> findByProvider(String providerId);

    List<Lead> findByBuyer(String buyerId);

    /**
     * Leads of any status submitted on the connection at or after {@code since}.
     */
    int countByConnectionSince(String connectionId, Instant since);

    /**
     * Insert the lead and store the updated connection totals as one unit.
     *
     * @return false (and nothing written) when the connection version no longer matches
     */
    boolean recordSubmission(Lead lead, Connection updatedConnection, long expectedVersion);

    /**
     * Store a status change only if the lead is still in {@code expectedStatus}.
     *
     * @return false (and nothing written) when the stored status has moved on
     */
    boolean updateStatus(Lead lead, LeadStatus expectedStatus);
}
