package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Driver marital status.
 */
public enum MaritalStatus {
    @JsonProperty("single") SINGLE,
    @JsonProperty("married") MARRIED,
    @JsonProperty("divorced") DIVORCED,
    @JsonProperty("widowed") WIDOWED
}
