package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Driving-history category. Categories are mutually exclusive; only the matching
 * surcharge applies.
 */
public enum DrivingHistory {
    @JsonProperty("clean") CLEAN,
    @JsonProperty("minor_violations") MINOR_VIOLATIONS,
    @JsonProperty("major_violations") MAJOR_VIOLATIONS,
    @JsonProperty("accidents") ACCIDENTS,
    @JsonProperty("dui") DUI
}
