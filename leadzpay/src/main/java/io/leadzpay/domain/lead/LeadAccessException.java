package io.leadzpay.domain.lead;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

public class LeadAccessException extends MarketplaceException {

    public LeadAccessException(String message) {
        super(ErrorCode.ACCESS_DENIED, message);
    }
}
