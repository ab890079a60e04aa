package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PrimaryUse {
    @JsonProperty("commute") COMMUTE,
    @JsonProperty("pleasure") PLEASURE,
    @JsonProperty("business") BUSINESS
}
