package io.leadzpay.domain.lead;

import io.leadzpay.domain.rating.VehicleDescriptor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A customer lead delivered over a connection.
 *
 * Payout is fixed at submission from the connection's rate and never changes afterwards.
 */
public record Lead(
    String id,
    String connectionId,
    String providerId,
    String buyerId,
    CustomerContact customer,
    String carModel,
    VehicleDescriptor vehicle,
    QuoteType quoteType,
    LeadStatus status,
    BigDecimal payout,
    SelectedQuote selectedQuote,
    Instant submittedAt,
    Instant claimedAt,
    Instant updatedAt
) {
    public Lead withStatus(LeadStatus newStatus, Instant now) {
        Instant claimed = newStatus == LeadStatus.CLAIMED && claimedAt == null ? now : claimedAt;
        return new Lead(id, connectionId, providerId, buyerId, customer, carModel, vehicle, quoteType,
            newStatus, payout, selectedQuote, submittedAt, claimed, now);
    }
}
