package io.leadzpay.service.connection;

import io.leadzpay.application.port.output.ConnectionRepository;
import io.leadzpay.application.service.ConnectionCoordinator;
import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.connection.ConcurrentConnectionUpdateException;
import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.connection.ConnectionAccessException;
import io.leadzpay.domain.connection.ConnectionAction;
import io.leadzpay.domain.connection.ConnectionNotFoundException;
import io.leadzpay.domain.connection.ConnectionStatus;
import io.leadzpay.domain.connection.ContractTerms;
import io.leadzpay.domain.connection.DuplicateConnectionException;
import io.leadzpay.domain.connection.ExclusivityConflictException;
import io.leadzpay.domain.connection.InvalidTransitionException;
import io.leadzpay.domain.user.Actor;
import io.leadzpay.domain.user.Role;
import io.leadzpay.infrastructure.metrics.MarketplaceMetrics;
import io.leadzpay.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Provider/buyer connection state machine.
 *
 * TRANSITIONS:
 * - set_terms    (buyer)    pending_buyer_review    → pending_provider_accept
 * - reject       (buyer)    pending_buyer_review    → rejected_by_buyer
 * - accept       (provider) pending_provider_accept → active
 * - decline      (provider) pending_provider_accept → declined_by_provider
 * - terminate    (either)   active                  → terminated
 * - update_terms (buyer)    active                  → active
 *
 * Every mutation runs on the connection's coordinator partition and is stored with a
 * version check against the state it was computed from.
 */
public final class ConnectionLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycleService.class);

    private final ConnectionRepository connections;
    private final ConnectionCoordinator coordinator;
    private final TermsValidator termsValidator;
    private final MarketplaceMetrics metrics;
    private final Clock clock;
    private final boolean enforceExclusivity;
    private final InputValidator inputValidator = new InputValidator();
    private final Map<String, Object> providerLocks = new ConcurrentHashMap<>();

    public ConnectionLifecycleService(
            ConnectionRepository connections,
            ConnectionCoordinator coordinator,
            TermsValidator termsValidator,
            MarketplaceMetrics metrics,
            Clock clock,
            boolean enforceExclusivity) {
        this.connections = connections;
        this.coordinator = coordinator;
        this.termsValidator = termsValidator;
        this.metrics = metrics;
        this.clock = clock;
        this.enforceExclusivity = enforceExclusivity;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Creation
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Provider asks a buyer to work together. The buyer reviews and sets terms.
     */
    public Connection requestConnection(Actor provider, String buyerId, String message) {
        requireRole(provider, Role.PROVIDER, "Only providers can request connections");
        requireId(buyerId, "buyerId");
        String note = inputValidator.validateFreeText(message, "message");

        return coordinator.call(pairKey(provider.userId(), buyerId), () -> {
            rejectDuplicate(provider.userId(), buyerId);

            Connection created = Connection.requested(newId(), provider.userId(), buyerId, note, now());
            connections.insert(created);
            metrics.recordTransition("request");

            log.info("Connection requested: {} provider={} buyer={}", created.id(), provider.userId(), buyerId);
            return created;
        });
    }

    /**
     * Buyer invites a provider with terms already set. The provider accepts or declines.
     */
    public Connection inviteProvider(Actor buyer, String providerId, ContractTerms terms, String message) {
        requireRole(buyer, Role.BUYER, "Only buyers can invite providers");
        requireId(providerId, "providerId");
        ContractTerms validated = termsValidator.validate(terms);
        String note = inputValidator.validateFreeText(message, "message");

        return coordinator.call(pairKey(providerId, buyer.userId()), () -> {
            rejectDuplicate(providerId, buyer.userId());

            Connection created = Connection.invited(newId(), providerId, buyer.userId(), validated, note, now());
            connections.insert(created);
            metrics.recordTransition("invite");

            log.info("Provider invited: {} provider={} buyer={} rate={}",
                created.id(), providerId, buyer.userId(), validated.ratePerLead());
            return created;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Transitions
    // ═══════════════════════════════════════════════════════════════════════

    public Connection setTerms(Actor buyer, String connectionId, ContractTerms terms) {
        ContractTerms validated = termsValidator.validate(terms);
        return transition(buyer, connectionId, ConnectionAction.SET_TERMS,
            current -> current.withTermsSet(validated, now()));
    }

    public Connection reject(Actor buyer, String connectionId) {
        return transition(buyer, connectionId, ConnectionAction.REJECT,
            current -> current.withResponse(ConnectionStatus.REJECTED_BY_BUYER, now()));
    }

    /**
     * Accepts for one provider are serialized on a per-provider lock, so the exclusivity
     * check sees every other accept that completed before it.
     */
    public Connection accept(Actor provider, String connectionId) {
        return coordinator.call(connectionId, () -> {
            Connection current = load(connectionId);
            synchronized (providerLocks.computeIfAbsent(current.providerId(), id -> new Object())) {
                return applyTransition(provider, connectionId, ConnectionAction.ACCEPT, pending -> {
                    checkExclusivity(pending);
                    return pending.withAccepted(now());
                });
            }
        });
    }

    public Connection decline(Actor provider, String connectionId) {
        return transition(provider, connectionId, ConnectionAction.DECLINE,
            current -> current.withResponse(ConnectionStatus.DECLINED_BY_PROVIDER, now()));
    }

    public Connection terminate(Actor party, String connectionId, String reason) {
        String cleanReason = inputValidator.validateFreeText(reason, "reason");
        return transition(party, connectionId, ConnectionAction.TERMINATE,
            current -> current.withTerminated(party.role(), cleanReason, now()));
    }

    /**
     * Replace the terms of an active connection. Leads already submitted keep their payout.
     */
    public Connection updateTerms(Actor buyer, String connectionId, ContractTerms terms) {
        ContractTerms validated = termsValidator.validate(terms);
        return transition(buyer, connectionId, ConnectionAction.UPDATE_TERMS,
            current -> current.withTermsUpdated(validated, now()));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * @throws ConnectionNotFoundException if the id is unknown
     * @throws ConnectionAccessException if the actor is neither a party nor an admin
     */
    public Connection get(Actor actor, String connectionId) {
        Connection connection = load(connectionId);
        if (!actor.isAdmin() && !connection.involves(actor)) {
            throw new ConnectionAccessException("Not a party to connection " + connectionId);
        }
        return connection;
    }

    /**
     * Connections where the actor is a party, newest first.
     */
    public List<Connection> listForActor(Actor actor, ConnectionFilter filter) {
        List<Connection> mine = switch (actor.role()) {
            case PROVIDER -> connections.findByProvider(actor.userId());
            case BUYER -> connections.findByBuyer(actor.userId());
            case ADMIN -> throw new ConnectionAccessException("Admins look up connections by id");
        };

        return switch (filter) {
            case ALL -> mine;
            case ACTIVE -> mine.stream().filter(Connection::isActive).toList();
            case PENDING -> {
                ConnectionStatus waitingOnMe = actor.isBuyer()
                    ? ConnectionStatus.PENDING_BUYER_REVIEW
                    : ConnectionStatus.PENDING_PROVIDER_ACCEPT;
                yield mine.stream().filter(c -> c.status() == waitingOnMe).toList();
            }
        };
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════════════

    private Connection transition(Actor actor, String connectionId, ConnectionAction action,
                                  UnaryOperator<Connection> change) {
        return coordinator.call(connectionId, () -> applyTransition(actor, connectionId, action, change));
    }

    /**
     * Load, check, change and store. Must run on the connection's coordinator partition.
     */
    private Connection applyTransition(Actor actor, String connectionId, ConnectionAction action,
                                       UnaryOperator<Connection> change) {
        Connection current = load(connectionId);
        authorize(actor, current, action);

        if (!action.allowedFrom(current.status())) {
            throw new InvalidTransitionException(action, current.status());
        }

        Connection next = change.apply(current);
        if (!connections.update(next, current.version())) {
            throw new ConcurrentConnectionUpdateException(connectionId, current.version());
        }
        metrics.recordTransition(action.wireName());

        log.info("Connection {} {}: {} → {} by {} {}",
            connectionId, action.wireName(), current.status().wireName(), next.status().wireName(),
            actor.role().wireName(), actor.userId());
        return next;
    }

    /**
     * The actor must be the connection's party for the action's role (either party when
     * the action has no required role).
     */
    static void authorize(Actor actor, Connection connection, ConnectionAction action) {
        Role required = action.requiredRole();
        boolean roleOk = required == null ? !actor.isAdmin() : actor.role() == required;
        if (!roleOk || !connection.involves(actor)) {
            String who = required == null ? "a party" : "the " + required.wireName();
            throw new ConnectionAccessException(
                "Only " + who + " of connection " + connection.id() + " can " + action.wireName());
        }
    }

    private void checkExclusivity(Connection accepting) {
        List<Connection> others = connections.findActiveByProvider(accepting.providerId()).stream()
            .filter(c -> !c.id().equals(accepting.id()))
            .toList();

        for (Connection other : others) {
            if (other.isExclusive() || accepting.isExclusive()) {
                if (enforceExclusivity) {
                    throw new ExclusivityConflictException(accepting.providerId(), other.id());
                }
                log.warn("Exclusivity overlap (advisory): provider {} accepting {} while {} is active",
                    accepting.providerId(), accepting.id(), other.id());
                return;
            }
        }
    }

    private void rejectDuplicate(String providerId, String buyerId) {
        connections.findNonTerminalByPair(providerId, buyerId).ifPresent(existing -> {
            throw new DuplicateConnectionException(providerId, buyerId, existing.id());
        });
    }

    private Connection load(String connectionId) {
        return connections.findById(connectionId)
            .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    private static void requireRole(Actor actor, Role role, String message) {
        if (actor.role() != role) {
            throw new ConnectionAccessException(message);
        }
    }

    private static void requireId(String id, String field) {
        if (id == null || id.isBlank()) {
            throw new InvalidRequestException(field + " is required");
        }
    }

    private static String pairKey(String providerId, String buyerId) {
        return providerId + "|" + buyerId;
    }

    private static String newId() {
        return "conn_" + UUID.randomUUID();
    }

    private Instant now() {
        return clock.instant();
    }
}
