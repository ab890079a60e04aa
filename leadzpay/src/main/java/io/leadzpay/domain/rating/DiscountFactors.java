package io.leadzpay.domain.rating;

/**
 * Carrier discount table. Each value is a fraction of the raw premium (0.05 = 5%).
 *
 * Not every factor is triggered by the rating profile (multiPolicy, loyalty, payInFull,
 * paperless, goodStudent and defensive have no profile input yet) but all are part of the
 * carrier's published table.
 */
public record DiscountFactors(
    double multiPolicy,
    double goodDriver,
    double goodStudent,
    double defensive,
    double antiTheft,
    double safety,
    double loyalty,
    double payInFull,
    double paperless,
    double military,
    double homeOwner,
    double married,
    double lowMileage,
    double goodCredit
) {}
