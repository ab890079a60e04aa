package io.leadzpay.service.lead;

import io.leadzpay.application.port.output.ConnectionRepository;
import io.leadzpay.application.port.output.LeadRepository;
import io.leadzpay.application.service.ConnectionCoordinator;
import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.connection.ConcurrentConnectionUpdateException;
import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.connection.ConnectionAccessException;
import io.leadzpay.domain.connection.ConnectionAction;
import io.leadzpay.domain.connection.ConnectionNotFoundException;
import io.leadzpay.domain.connection.InvalidTransitionException;
import io.leadzpay.domain.connection.LeadCaps;
import io.leadzpay.domain.lead.CustomerContact;
import io.leadzpay.domain.lead.Lead;
import io.leadzpay.domain.lead.LeadStatus;
import io.leadzpay.domain.lead.LeadSubmission;
import io.leadzpay.domain.lead.QuoteType;
import io.leadzpay.domain.user.Actor;
import io.leadzpay.infrastructure.metrics.MarketplaceMetrics;
import io.leadzpay.security.InputValidator;
import io.leadzpay.service.rating.VehicleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Lead Ledger - gates lead submission on a connection and books its payout.
 *
 * SUBMISSION FLOW (on the connection's coordinator partition):
 * 1. Connection must exist, belong to the provider and be active
 * 2. Count leads since Monday 00:00 and since the 1st 00:00 (every status counts)
 * 3. If a cap is reached and the terms pause on cap: refuse, nothing stored
 * 4. Otherwise fix payout = current ratePerLead, insert the lead and bump the
 *    connection totals in one repository call
 *
 * Payouts are never reversed when a lead is later rejected or expires.
 */
public final class LeadLedger {
    private static final Logger log = LoggerFactory.getLogger(LeadLedger.class);

    private final ConnectionRepository connections;
    private final LeadRepository leads;
    private final ConnectionCoordinator coordinator;
    private final CapWindows windows;
    private final VehicleParser vehicleParser;
    private final MarketplaceMetrics metrics;
    private final InputValidator inputValidator = new InputValidator();

    public LeadLedger(
            ConnectionRepository connections,
            LeadRepository leads,
            ConnectionCoordinator coordinator,
            CapWindows windows,
            VehicleParser vehicleParser,
            MarketplaceMetrics metrics) {
        this.connections = connections;
        this.leads = leads;
        this.coordinator = coordinator;
        this.windows = windows;
        this.vehicleParser = vehicleParser;
        this.metrics = metrics;
    }

    /**
     * Submit a lead on an active connection.
     *
     * @return accepted with the stored lead, or capReached with the blocking cap status
     * @throws ConnectionNotFoundException if the connection does not exist
     * @throws ConnectionAccessException if the actor is not the connection's provider
     * @throws InvalidTransitionException if the connection is not active
     */
    public LeadSubmissionResult submitLead(Actor provider, String connectionId, LeadSubmission submission) {
        if (submission == null) {
            throw new InvalidRequestException("Lead submission is required");
        }
        CustomerContact customer = inputValidator.validateCustomer(submission.customer());
        String carModel = inputValidator.validateCarModel(submission.carModel());

        return coordinator.call(connectionId, () -> {
            Connection current = load(connectionId);
            if (!provider.isProvider() || !current.involves(provider)) {
                throw new ConnectionAccessException(
                    "Only the provider of connection " + connectionId + " can submit leads");
            }
            if (!ConnectionAction.SUBMIT_LEAD.allowedFrom(current.status())) {
                throw new InvalidTransitionException(ConnectionAction.SUBMIT_LEAD, current.status());
            }

            LeadCaps caps = current.terms().leadCaps();
            int weeklyUsed = leads.countByConnectionSince(connectionId, windows.weekStart());
            int monthlyUsed = leads.countByConnectionSince(connectionId, windows.monthStart());
            LeadCapStatus before = LeadCapStatus.evaluate(caps, weeklyUsed, monthlyUsed);

            if (!before.canSubmit()) {
                metrics.recordCapRejection(before.reachedWindow());
                log.warn("Lead refused on connection {}: {} ({})", connectionId, before.message(), before.summary());
                return LeadSubmissionResult.capReached(before);
            }

            Instant now = windows.now();
            BigDecimal payout = current.terms().ratePerLead();

            Lead lead = new Lead(
                newId(),
                current.id(),
                current.providerId(),
                current.buyerId(),
                customer,
                carModel,
                vehicleParser.parse(carModel),
                submission.quoteType() != null ? submission.quoteType() : QuoteType.QUOTE,
                LeadStatus.PENDING,
                payout,
                submission.selectedQuote(),
                now,
                null,
                now);

            Connection updated = current.withLeadRecorded(payout, now);
            if (!leads.recordSubmission(lead, updated, current.version())) {
                throw new ConcurrentConnectionUpdateException(connectionId, current.version());
            }
            metrics.recordLeadSubmitted(payout);

            LeadCapStatus after = LeadCapStatus.evaluate(caps, weeklyUsed + 1, monthlyUsed + 1);
            log.info("Lead {} submitted on connection {}: payout={} totalLeads={} totalPaid={} caps={}",
                lead.id(), connectionId, payout, updated.totalLeads(), updated.totalPaid(), after.summary());
            return LeadSubmissionResult.accepted(lead, after);
        });
    }

    /**
     * Current cap usage for a connection. Readable by either party and admins.
     */
    public LeadCapStatus capStatus(Actor actor, String connectionId) {
        Connection connection = load(connectionId);
        if (!actor.isAdmin() && !connection.involves(actor)) {
            throw new ConnectionAccessException("Not a party to connection " + connectionId);
        }

        LeadCaps caps = connection.terms() != null ? connection.terms().leadCaps() : null;
        return LeadCapStatus.evaluate(caps,
            leads.countByConnectionSince(connectionId, windows.weekStart()),
            leads.countByConnectionSince(connectionId, windows.monthStart()));
    }

    private Connection load(String connectionId) {
        return connections.findById(connectionId)
            .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    private static String newId() {
        return "lead_" + UUID.randomUUID();
    }
}
