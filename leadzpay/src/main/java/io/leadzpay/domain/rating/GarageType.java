package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where the vehicle is usually parked.
 */
public enum GarageType {
    @JsonProperty("garage") GARAGE,
    @JsonProperty("carport") CARPORT,
    @JsonProperty("street") STREET,
    @JsonProperty("parking_lot") PARKING_LOT,
    @JsonProperty("driveway") DRIVEWAY
}
