package io.leadzpay.domain.connection;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

/**
 * The actor is not the party allowed to read or change the resource.
 */
public class ConnectionAccessException extends MarketplaceException {

    public ConnectionAccessException(String message) {
        super(ErrorCode.ACCESS_DENIED, message);
    }
}
