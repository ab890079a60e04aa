package io.leadzpay.domain.rating;

import java.util.List;

/**
 * One carrier's priced quote for a rating profile.
 *
 * Invariants: annualPremium >= 300, monthlyPremium = round(annualPremium / 12),
 * totalDiscount <= 50. Percentages are whole numbers.
 */
public record QuoteResult(
    String carrierId,
    String carrierName,
    String carrierColor,
    boolean exclusive,
    double rating,

    long monthlyPremium,
    long annualPremium,
    long semiannualPremium,

    String coverageType,
    int deductible,

    List<String> discountsApplied,
    long totalDiscount,
    List<String> surchargesApplied,
    long totalSurcharge,

    Breakdown breakdown
) {
    public QuoteResult {
        discountsApplied = List.copyOf(discountsApplied);
        surchargesApplied = List.copyOf(surchargesApplied);
    }

    /**
     * Multiplicative factors and dollar adjustments behind the premium.
     */
    public record Breakdown(
        double basePremium,
        double ageFactor,
        double vehicleFactor,
        double stateFactor,
        long discountAmount,
        long surchargeAmount
    ) {}
}
