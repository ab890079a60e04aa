package io.leadzpay.domain.lead;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * What the customer asked for.
 */
public enum QuoteType {
    @JsonProperty("asap") ASAP,       // Call the customer now
    @JsonProperty("switch") SWITCH,   // Switching carriers
    @JsonProperty("quote") QUOTE;     // Quote only

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
