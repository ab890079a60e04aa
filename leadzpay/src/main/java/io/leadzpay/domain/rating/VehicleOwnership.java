package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum VehicleOwnership {
    @JsonProperty("owned") OWNED,
    @JsonProperty("financed") FINANCED,
    @JsonProperty("leased") LEASED
}
