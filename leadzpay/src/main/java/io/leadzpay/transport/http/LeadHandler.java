package io.leadzpay.transport.http;

import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.user.Actor;
import io.leadzpay.service.lead.LeadService;
import io.undertow.server.HttpServerExchange;

import java.util.Map;

import static io.leadzpay.transport.http.HttpSupport.handle;
import static io.leadzpay.transport.http.HttpSupport.pathParam;
import static io.leadzpay.transport.http.HttpSupport.readBody;
import static io.leadzpay.transport.http.HttpSupport.sendJson;

/**
 * HTTP handler for lead queries and status updates.
 */
public final class LeadHandler {

    private final LeadService leadService;

    public LeadHandler(LeadService leadService) {
        this.leadService = leadService;
    }

    /**
     * GET /api/leads
     */
    public void list(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            sendJson(exchange, Map.of("leads", leadService.listForActor(actor)));
        });
    }

    /**
     * GET /api/leads/{id}
     */
    public void get(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            sendJson(exchange, leadService.get(actor, pathParam(exchange, "id")));
        });
    }

    /**
     * PATCH /api/leads/{id} - {"status": claimed|converted|rejected|expired}
     */
    public void updateStatus(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            ConnectionRequests.LeadStatusChange request = readBody(exchange, ConnectionRequests.LeadStatusChange.class);
            if (request.status() == null) {
                throw new InvalidRequestException("status is required");
            }
            sendJson(exchange, leadService.updateStatus(actor, pathParam(exchange, "id"), request.status()));
        });
    }
}
