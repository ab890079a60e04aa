package io.leadzpay.domain.common;

/**
 * Root of all marketplace domain failures.
 *
 * Unchecked: callers that can act on a specific failure catch the subclass; everything
 * else reaches the transport layer, which maps the code to an HTTP status.
 */
public class MarketplaceException extends RuntimeException {

    private final ErrorCode code;

    public MarketplaceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public MarketplaceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
