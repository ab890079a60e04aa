package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Coverage tier selected for a quote.
 */
public enum CoverageType {
    @JsonProperty("liability") LIABILITY("Liability Only"),
    @JsonProperty("collision") COLLISION("Liability + Collision"),
    @JsonProperty("comprehensive") COMPREHENSIVE("Liability + Comprehensive"),
    @JsonProperty("full") FULL("Full Coverage");

    private final String label;

    CoverageType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
