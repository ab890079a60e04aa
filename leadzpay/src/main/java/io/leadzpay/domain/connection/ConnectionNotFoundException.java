package io.leadzpay.domain.connection;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

public class ConnectionNotFoundException extends MarketplaceException {

    public ConnectionNotFoundException(String connectionId) {
        super(ErrorCode.CONNECTION_NOT_FOUND, "Connection not found: " + connectionId);
    }
}
