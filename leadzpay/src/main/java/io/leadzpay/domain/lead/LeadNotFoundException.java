package io.leadzpay.domain.lead;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

public class LeadNotFoundException extends MarketplaceException {

    public LeadNotFoundException(String leadId) {
        super(ErrorCode.LEAD_NOT_FOUND, "Lead not found: " + leadId);
    }
}
