package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Self-reported credit tier.
 */
public enum CreditTier {
    @JsonProperty("excellent") EXCELLENT,
    @JsonProperty("good") GOOD,
    @JsonProperty("fair") FAIR,
    @JsonProperty("poor") POOR
}
