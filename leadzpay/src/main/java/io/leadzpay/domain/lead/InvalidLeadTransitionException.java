package io.leadzpay.domain.lead;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

public class InvalidLeadTransitionException extends MarketplaceException {

    private final LeadStatus from;
    private final LeadStatus to;

    public InvalidLeadTransitionException(LeadStatus from, LeadStatus to) {
        super(ErrorCode.INVALID_LEAD_TRANSITION,
            "Cannot move lead from " + from.wireName() + " to " + to.wireName());
        this.from = from;
        this.to = to;
    }

    public LeadStatus getFrom() {
        return from;
    }

    public LeadStatus getTo() {
        return to;
    }
}
