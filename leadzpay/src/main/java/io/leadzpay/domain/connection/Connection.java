package io.leadzpay.domain.connection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.leadzpay.domain.user.Actor;
import io.leadzpay.domain.user.Role;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Provider/buyer relationship and its running lead totals.
 * Immutable: every change produces a copy with version + 1.
 */
public record Connection(
    String id,
    String providerId,
    String buyerId,
    Role initiator,          // PROVIDER | BUYER
    String message,
    ConnectionStatus status,
    ContractTerms terms,     // null until the buyer sets terms

    // Running totals
    int totalLeads,
    BigDecimal totalPaid,
    Instant lastLeadAt,

    // Timestamps
    Instant createdAt,
    Instant termsSetAt,
    Instant termsUpdatedAt,
    Instant acceptedAt,
    Instant respondedAt,
    Instant terminatedAt,
    Role terminatedBy,
    String terminationReason,

    long version
) {
    public Connection {
        if (totalPaid == null) totalPaid = BigDecimal.ZERO;
    }

    /**
     * New connection requested by a provider, awaiting buyer review.
     */
    public static Connection requested(String id, String providerId, String buyerId, String message, Instant now) {
        return new Connection(id, providerId, buyerId, Role.PROVIDER, message,
            ConnectionStatus.PENDING_BUYER_REVIEW, null,
            0, BigDecimal.ZERO, null,
            now, null, null, null, null, null, null, null,
            0);
    }

    /**
     * New connection offered by a buyer with terms, awaiting provider acceptance.
     */
    public static Connection invited(String id, String providerId, String buyerId, ContractTerms terms,
                                     String message, Instant now) {
        return new Connection(id, providerId, buyerId, Role.BUYER, message,
            ConnectionStatus.PENDING_PROVIDER_ACCEPT, terms,
            0, BigDecimal.ZERO, null,
            now, now, null, null, null, null, null, null,
            0);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == ConnectionStatus.ACTIVE;
    }

    public boolean involves(Actor actor) {
        return switch (actor.role()) {
            case PROVIDER -> providerId.equals(actor.userId());
            case BUYER -> buyerId.equals(actor.userId());
            case ADMIN -> false;
        };
    }

    @JsonIgnore
    public boolean isExclusive() {
        return terms != null && terms.exclusivity();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Immutable Update Helpers (for ConnectionLifecycleService / LeadLedger)
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Buyer set terms on a provider request; hand over to the provider.
     */
    public Connection withTermsSet(ContractTerms newTerms, Instant now) {
        return new Connection(id, providerId, buyerId, initiator, message,
            ConnectionStatus.PENDING_PROVIDER_ACCEPT, newTerms,
            totalLeads, totalPaid, lastLeadAt,
            createdAt, now, termsUpdatedAt, acceptedAt, now, terminatedAt, terminatedBy, terminationReason,
            version + 1);
    }

    /**
     * Revised terms on an active connection. Applies to later leads only.
     */
    public Connection withTermsUpdated(ContractTerms newTerms, Instant now) {
        return new Connection(id, providerId, buyerId, initiator, message,
            status, newTerms,
            totalLeads, totalPaid, lastLeadAt,
            createdAt, termsSetAt, now, acceptedAt, respondedAt, terminatedAt, terminatedBy, terminationReason,
            version + 1);
    }

    public Connection withAccepted(Instant now) {
        return new Connection(id, providerId, buyerId, initiator, message,
            ConnectionStatus.ACTIVE, terms,
            totalLeads, totalPaid, lastLeadAt,
            createdAt, termsSetAt, termsUpdatedAt, acceptedAt != null ? acceptedAt : now, now,
            terminatedAt, terminatedBy, terminationReason,
            version + 1);
    }

    /**
     * Pending connection closed by one side (REJECTED_BY_BUYER or DECLINED_BY_PROVIDER).
     */
    public Connection withResponse(ConnectionStatus newStatus, Instant now) {
        return new Connection(id, providerId, buyerId, initiator, message,
            newStatus, terms,
            totalLeads, totalPaid, lastLeadAt,
            createdAt, termsSetAt, termsUpdatedAt, acceptedAt, now, terminatedAt, terminatedBy, terminationReason,
            version + 1);
    }

    public Connection withTerminated(Role by, String reason, Instant now) {
        return new Connection(id, providerId, buyerId, initiator, message,
            ConnectionStatus.TERMINATED, terms,
            totalLeads, totalPaid, lastLeadAt,
            createdAt, termsSetAt, termsUpdatedAt, acceptedAt, respondedAt, now, by, reason,
            version + 1);
    }

    /**
     * Accrue one accepted lead.
     */
    public Connection withLeadRecorded(BigDecimal payout, Instant now) {
        return new Connection(id, providerId, buyerId, initiator, message,
            status, terms,
            totalLeads + 1, totalPaid.add(payout), now,
            createdAt, termsSetAt, termsUpdatedAt, acceptedAt, respondedAt, terminatedAt, terminatedBy,
            terminationReason,
            version + 1);
    }
}
