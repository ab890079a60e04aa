package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Locale;
import java.util.Map;

/**
 * Rating configuration for one insurance carrier.
 * Built once at startup by CarrierCatalog; never mutated.
 */
public record CarrierConfig(
    String id,
    String name,
    String color,
    CarrierEligibility eligibility,
    double avgRating,
    BaseRates baseRates,
    DiscountFactors discounts,
    SurchargeFactors surcharges,
    Map<String, Double> stateMultipliers,
    boolean available
) {
    public CarrierConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Carrier id is required");
        }
        if (eligibility == null) {
            eligibility = CarrierEligibility.OPEN;
        }
        stateMultipliers = stateMultipliers == null ? Map.of() : Map.copyOf(stateMultipliers);
    }

    @JsonIgnore
    public boolean isExclusive() {
        return eligibility.isExclusive();
    }

    /**
     * Multiplier for a state code, 1.0 when the carrier has no entry for it.
     */
    public double stateMultiplier(String state) {
        if (state == null) {
            return 1.0;
        }
        Double multiplier = stateMultipliers.get(state.trim().toUpperCase(Locale.ROOT));
        return multiplier != null ? multiplier : 1.0;
    }
}
