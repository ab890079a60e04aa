package io.leadzpay.domain.connection;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

public class InvalidTermsException extends MarketplaceException {

    public InvalidTermsException(String message) {
        super(ErrorCode.INVALID_TERMS, message);
    }
}
