package io.leadzpay.domain.connection;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

/**
 * A pending or active connection already exists for the provider/buyer pair.
 */
public class DuplicateConnectionException extends MarketplaceException {

    private final String existingConnectionId;

    public DuplicateConnectionException(String providerId, String buyerId, String existingConnectionId) {
        super(ErrorCode.DUPLICATE_CONNECTION,
            "Connection already exists between provider " + providerId + " and buyer " + buyerId);
        this.existingConnectionId = existingConnectionId;
    }

    public String getExistingConnectionId() {
        return existingConnectionId;
    }
}
