package io.leadzpay.domain.connection;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

/**
 * Optimistic version check failed: another writer changed the connection first.
 */
public class ConcurrentConnectionUpdateException extends MarketplaceException {

    public ConcurrentConnectionUpdateException(String connectionId, long expectedVersion) {
        super(ErrorCode.CONCURRENT_UPDATE,
            "Connection " + connectionId + " was modified concurrently (expected version " + expectedVersion + ")");
    }
}
