package io.leadzpay.domain.lead;

/**
 * Snapshot of the quote the customer picked, frozen on the lead.
 */
public record SelectedQuote(
    String carrierId,
    String carrierName,
    long monthlyPremium,
    long annualPremium,
    String coverageType,
    int deductible
) {}
