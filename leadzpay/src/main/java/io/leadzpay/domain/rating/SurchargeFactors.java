package io.leadzpay.domain.rating;

/**
 * Carrier surcharge table. Each value is a fraction of the raw premium (0.45 = 45%).
 */
public record SurchargeFactors(
    double youngDriver,      // Under 25
    double seniorDriver,     // Over 70
    double poorCredit,       // Half weight for fair credit
    double noHistory,        // No prior insurance
    double lapse,            // Gap in coverage
    double minorViolation,
    double majorViolation,
    double accident,         // At-fault
    double dui,
    double highMileage,      // Over 15,000 miles/year
    double newDriver         // Less than 3 years licensed
) {}
