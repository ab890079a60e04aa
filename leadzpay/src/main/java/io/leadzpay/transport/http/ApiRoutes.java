package io.leadzpay.transport.http;

import io.leadzpay.domain.common.ErrorCode;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Route table for the marketplace API, wrapped with CORS and moved off the IO threads.
 */
public final class ApiRoutes {

    private static final HttpString PATCH = HttpString.tryFromString("PATCH");

    public static HttpHandler build(
            RatingHandler rating,
            ConnectionHandler connections,
            LeadHandler leads,
            HttpHandler metricsHandler,
            Clock clock) {

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", exchange -> HttpSupport.handle(exchange, () -> {
                Map<String, Object> health = new LinkedHashMap<>();
                health.put("status", "ok");
                health.put("ts", clock.instant().toString());
                HttpSupport.sendJson(exchange, health);
            }))
            // Rating
            .get("/api/carriers", rating::listCarriers)
            .get("/api/carriers/{carrierId}", rating::getCarrier)
            .post("/api/quotes", rating::computeQuotes)
            .get("/api/quotes/preview", rating::previewCoverages)
            // Connections
            .get("/api/connections", connections::list)
            .post("/api/connections", connections::create)
            .get("/api/connections/{id}", connections::get)
            .add(PATCH, "/api/connections/{id}", connections::act)
            .get("/api/connections/{id}/caps", connections::caps)
            .post("/api/connections/{id}/leads", connections::submitLead)
            // Leads
            .get("/api/leads", leads::list)
            .get("/api/leads/{id}", leads::get)
            .add(PATCH, "/api/leads/{id}", leads::updateStatus)
            .setFallbackHandler(exchange -> HttpSupport.sendError(exchange, StatusCodes.NOT_FOUND,
                ErrorCode.INVALID_REQUEST,
                "No route for " + exchange.getRequestMethod() + " " + exchange.getRequestPath()));

        HttpHandler blocking = new BlockingHandler(routes);

        // CORS Handler
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PATCH, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, X-User-Id, X-User-Role")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(StatusCodes.OK);
                exchange.endExchange();
            } else {
                blocking.handleRequest(exchange);
            }
        };
    }

    private ApiRoutes() {}
}
