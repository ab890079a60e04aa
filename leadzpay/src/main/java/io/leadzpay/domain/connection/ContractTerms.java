package io.leadzpay.domain.connection;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Commercial terms of a provider/buyer connection.
 *
 * Absent optional values are normalized on construction: rate $50, per-lead timing,
 * lead types {auto}, 7 days notice, agreement version 1.0.0.
 */
public record ContractTerms(
    BigDecimal ratePerLead,
    PaymentTiming paymentTiming,
    BigDecimal minimumPayoutThreshold,
    Set<String> leadTypes,
    boolean exclusivity,
    String notes,
    Integer terminationNoticeDays,
    LeadCaps leadCaps,
    List<String> licensedStates,
    boolean complianceAcknowledged,
    String agreementVersion
) {
    public static final BigDecimal DEFAULT_RATE = new BigDecimal("50");
    public static final int DEFAULT_NOTICE_DAYS = 7;
    public static final String DEFAULT_AGREEMENT_VERSION = "1.0.0";
    public static final String DEFAULT_LEAD_TYPE = "auto";

    public ContractTerms {
        if (ratePerLead == null) ratePerLead = DEFAULT_RATE;
        if (paymentTiming == null) paymentTiming = PaymentTiming.PER_LEAD;
        leadTypes = leadTypes == null || leadTypes.isEmpty() ? Set.of(DEFAULT_LEAD_TYPE) : Set.copyOf(leadTypes);
        if (terminationNoticeDays == null) terminationNoticeDays = DEFAULT_NOTICE_DAYS;
        licensedStates = licensedStates == null ? List.of() : List.copyOf(licensedStates);
        if (agreementVersion == null || agreementVersion.isBlank()) agreementVersion = DEFAULT_AGREEMENT_VERSION;
    }

    /**
     * Terms with only a per-lead rate; everything else defaulted.
     */
    public static ContractTerms ofRate(BigDecimal ratePerLead) {
        return new ContractTerms(ratePerLead, null, null, null, false, null, null, null, null, false, null);
    }

    public ContractTerms withLeadCaps(LeadCaps caps) {
        return new ContractTerms(ratePerLead, paymentTiming, minimumPayoutThreshold, leadTypes, exclusivity,
            notes, terminationNoticeDays, caps, licensedStates, complianceAcknowledged, agreementVersion);
    }

    public ContractTerms withExclusivity(boolean exclusive) {
        return new ContractTerms(ratePerLead, paymentTiming, minimumPayoutThreshold, leadTypes, exclusive,
            notes, terminationNoticeDays, leadCaps, licensedStates, complianceAcknowledged, agreementVersion);
    }
}
