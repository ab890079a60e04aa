package io.leadzpay.domain.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Who a carrier is allowed to quote.
 *
 * DIRECT_ONLY carriers sell direct-to-consumer (exclusive for agents) but quote everyone.
 * MILITARY_ONLY carriers only quote military occupations.
 */
public enum CarrierEligibility {
    @JsonProperty("open") OPEN,
    @JsonProperty("direct_only") DIRECT_ONLY,
    @JsonProperty("military_only") MILITARY_ONLY;

    public boolean isExclusive() {
        return this != OPEN;
    }

    public boolean admits(Occupation occupation) {
        return this != MILITARY_ONLY || occupation == Occupation.MILITARY;
    }
}
