package io.leadzpay.domain.connection;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;

/**
 * The action is not allowed from the connection's current status.
 */
public class InvalidTransitionException extends MarketplaceException {

    private final ConnectionAction action;
    private final ConnectionStatus currentStatus;

    public InvalidTransitionException(ConnectionAction action, ConnectionStatus currentStatus) {
        super(ErrorCode.INVALID_TRANSITION,
            "Cannot " + action.wireName() + " a connection in status " + currentStatus.wireName());
        this.action = action;
        this.currentStatus = currentStatus;
    }

    public ConnectionAction getAction() {
        return action;
    }

    public ConnectionStatus getCurrentStatus() {
        return currentStatus;
    }
}
