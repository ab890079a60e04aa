package io.leadzpay.transport.http;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.MarketplaceException;
import io.leadzpay.domain.user.Actor;
import io.leadzpay.domain.user.Role;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;

/**
 * Reads the authenticated actor from the identity headers set by the upstream gateway.
 */
public final class ActorResolver {

    public static final HttpString USER_ID_HEADER = HttpString.tryFromString("X-User-Id");
    public static final HttpString USER_ROLE_HEADER = HttpString.tryFromString("X-User-Role");

    /**
     * @throws MarketplaceException with UNAUTHENTICATED when either header is missing or the
     *         role is unknown
     */
    public static Actor resolve(HttpServerExchange exchange) {
        String userId = exchange.getRequestHeaders().getFirst(USER_ID_HEADER);
        String role = exchange.getRequestHeaders().getFirst(USER_ROLE_HEADER);

        if (userId == null || userId.isBlank() || role == null || role.isBlank()) {
            throw new MarketplaceException(ErrorCode.UNAUTHENTICATED, "Missing identity headers");
        }
        try {
            return new Actor(userId.trim(), Role.fromWire(role));
        } catch (IllegalArgumentException e) {
            throw new MarketplaceException(ErrorCode.UNAUTHENTICATED, "Unknown role: " + role, e);
        }
    }

    private ActorResolver() {}
}
