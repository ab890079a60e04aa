package io.leadzpay.domain.rating;

/**
 * Structured form of a free-text "YYYY Make Model" vehicle description.
 */
public record VehicleDescriptor(
    int year,
    String make,
    String model
) {}
