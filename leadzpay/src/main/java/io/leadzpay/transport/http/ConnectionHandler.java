package io.leadzpay.transport.http;

import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.connection.ConnectionAction;
import io.leadzpay.domain.connection.ConnectionAccessException;
import io.leadzpay.domain.lead.LeadSubmission;
import io.leadzpay.domain.user.Actor;
import io.leadzpay.service.connection.ConnectionFilter;
import io.leadzpay.service.connection.ConnectionLifecycleService;
import io.leadzpay.service.lead.LeadLedger;
import io.leadzpay.service.lead.LeadSubmissionResult;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.util.List;
import java.util.Map;

import static io.leadzpay.transport.http.HttpSupport.handle;
import static io.leadzpay.transport.http.HttpSupport.pathParam;
import static io.leadzpay.transport.http.HttpSupport.queryParam;
import static io.leadzpay.transport.http.HttpSupport.readBody;
import static io.leadzpay.transport.http.HttpSupport.sendJson;

/**
 * HTTP handler for provider/buyer connections, their caps and lead submission.
 */
public final class ConnectionHandler {

    private static final int TOO_MANY_REQUESTS = 429;

    private final ConnectionLifecycleService lifecycle;
    private final LeadLedger ledger;

    public ConnectionHandler(ConnectionLifecycleService lifecycle, LeadLedger ledger) {
        this.lifecycle = lifecycle;
        this.ledger = ledger;
    }

    /**
     * GET /api/connections?status=all|pending|active
     */
    public void list(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            ConnectionFilter filter = ConnectionFilter.fromWire(queryParam(exchange, "status"));
            List<Connection> connections = lifecycle.listForActor(actor, filter);
            sendJson(exchange, Map.of("connections", connections));
        });
    }

    /**
     * POST /api/connections - Provider request or buyer invitation, depending on the caller's role
     */
    public void create(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            ConnectionRequests.Create request = readBody(exchange, ConnectionRequests.Create.class);

            Connection created = switch (actor.role()) {
                case PROVIDER -> lifecycle.requestConnection(actor, request.buyerId(), request.message());
                case BUYER -> lifecycle.inviteProvider(actor, request.providerId(), request.terms(), request.message());
                case ADMIN -> throw new ConnectionAccessException("Admins cannot create connections");
            };
            sendJson(exchange, StatusCodes.CREATED, created);
        });
    }

    /**
     * GET /api/connections/{id}
     */
    public void get(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            sendJson(exchange, lifecycle.get(actor, pathParam(exchange, "id")));
        });
    }

    /**
     * PATCH /api/connections/{id} - {"action": set_terms|accept|decline|reject|terminate|update_terms, ...}
     */
    public void act(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            String id = pathParam(exchange, "id");
            ConnectionRequests.Action request = readBody(exchange, ConnectionRequests.Action.class);
            ConnectionAction action = ConnectionAction.fromWire(request.action());

            Connection updated = switch (action) {
                case SET_TERMS -> lifecycle.setTerms(actor, id, request.terms());
                case ACCEPT -> lifecycle.accept(actor, id);
                case DECLINE -> lifecycle.decline(actor, id);
                case REJECT -> lifecycle.reject(actor, id);
                case TERMINATE -> lifecycle.terminate(actor, id, request.reason());
                case UPDATE_TERMS -> lifecycle.updateTerms(actor, id, request.terms());
                case SUBMIT_LEAD -> throw new IllegalArgumentException(
                    "Submit leads with POST /api/connections/" + id + "/leads");
            };
            sendJson(exchange, updated);
        });
    }

    /**
     * GET /api/connections/{id}/caps
     */
    public void caps(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            sendJson(exchange, ledger.capStatus(actor, pathParam(exchange, "id")));
        });
    }

    /**
     * POST /api/connections/{id}/leads - 201 with the lead, or 429 with the cap status
     */
    public void submitLead(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Actor actor = ActorResolver.resolve(exchange);
            LeadSubmission submission = readBody(exchange, LeadSubmission.class);
            LeadSubmissionResult result = ledger.submitLead(actor, pathParam(exchange, "id"), submission);

            if (result.accepted()) {
                sendJson(exchange, StatusCodes.CREATED, Map.of("lead", result.lead(), "capStatus", result.capStatus()));
            } else {
                sendJson(exchange, TOO_MANY_REQUESTS, Map.of(
                    "error", "lead_cap_reached",
                    "message", result.capStatus().message(),
                    "capStatus", result.capStatus()));
            }
        });
    }
}
