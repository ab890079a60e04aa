package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Occupation category used for eligibility and the military discount.
 */
public enum Occupation {
    @JsonProperty("standard") STANDARD,
    @JsonProperty("professional") PROFESSIONAL,
    @JsonProperty("military") MILITARY,
    @JsonProperty("student") STUDENT
}
