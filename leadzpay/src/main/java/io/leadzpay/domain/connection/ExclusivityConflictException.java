package io.leadzpay.domain.connection;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

public class ExclusivityConflictException extends MarketplaceException {

    public ExclusivityConflictException(String providerId, String conflictingConnectionId) {
        super(ErrorCode.EXCLUSIVITY_CONFLICT,
            "Provider " + providerId + " already has an exclusive arrangement (connection "
                + conflictingConnectionId + ")");
    }
}
