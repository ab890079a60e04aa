package io.leadzpay.domain.connection;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * When accrued payouts are settled. Pricing is always per lead.
 */
public enum PaymentTiming {
    @JsonProperty("per_lead") PER_LEAD,
    @JsonProperty("weekly") WEEKLY,
    @JsonProperty("biweekly") BIWEEKLY,
    @JsonProperty("monthly") MONTHLY
}
