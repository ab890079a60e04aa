package io.leadzpay.domain.common;

/**
 * Malformed or incomplete request input.
 */
public class InvalidRequestException extends MarketplaceException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(ErrorCode.INVALID_REQUEST, message, cause);
    }
}
