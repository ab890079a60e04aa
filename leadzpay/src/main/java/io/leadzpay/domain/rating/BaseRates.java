package io.leadzpay.domain.rating;

/**
 * Annual base premium per coverage tier, in dollars.
 */
public record BaseRates(
    double liability,
    double collision,
    double comprehensive,
    double full
) {
    public double forCoverage(CoverageType type) {
        return switch (type) {
            case LIABILITY -> liability;
            case COLLISION -> collision;
            case COMPREHENSIVE -> comprehensive;
            case FULL -> full;
        };
    }
}
