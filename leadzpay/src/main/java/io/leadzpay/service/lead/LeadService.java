package io.leadzpay.service.lead;

import io.leadzpay.application.port.output.LeadRepository;
import io.leadzpay.domain.lead.InvalidLeadTransitionException;
import io.leadzpay.domain.lead.Lead;
import io.leadzpay.domain.lead.LeadAccessException;
import io.leadzpay.domain.lead.LeadNotFoundException;
import io.leadzpay.domain.lead.LeadStatus;
import io.leadzpay.domain.user.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Lead queries and buyer-side status updates.
 *
 * Status changes never touch payout or connection totals.
 */
public final class LeadService {
    private static final Logger log = LoggerFactory.getLogger(LeadService.class);

    private final LeadRepository leads;
    private final Clock clock;

    public LeadService(LeadRepository leads, Clock clock) {
        this.leads = leads;
        this.clock = clock;
    }

    public Lead get(Actor actor, String leadId) {
        Lead lead = load(leadId);
        if (!actor.isAdmin() && !isParty(actor, lead)) {
            throw new LeadAccessException("Not a party to lead " + leadId);
        }
        return lead;
    }

    /**
     * Providers see leads they submitted; buyers see leads addressed to them.
     */
    public List<Lead> listForActor(Actor actor) {
        return switch (actor.role()) {
            case PROVIDER -> leads.findByProvider(actor.userId());
            case BUYER -> leads.findByBuyer(actor.userId());
            case ADMIN -> throw new LeadAccessException("Admins look up leads by id");
        };
    }

    /**
     * Move a lead along pending → claimed → converted (or to rejected / expired).
     *
     * @throws LeadAccessException if the actor is not the lead's buyer
     * @throws InvalidLeadTransitionException for moves the lifecycle does not allow
     */
    public Lead updateStatus(Actor buyer, String leadId, LeadStatus newStatus) {
        Lead lead = load(leadId);
        if (!buyer.isBuyer() || !lead.buyerId().equals(buyer.userId())) {
            throw new LeadAccessException("Only the buyer of lead " + leadId + " can change its status");
        }
        if (!lead.status().canTransitionTo(newStatus)) {
            throw new InvalidLeadTransitionException(lead.status(), newStatus);
        }

        Lead updated = lead.withStatus(newStatus, clock.instant());
        if (!leads.updateStatus(updated, lead.status())) {
            // Another update won; judge the move against what is stored now
            LeadStatus stored = load(leadId).status();
            throw new InvalidLeadTransitionException(stored, newStatus);
        }

        log.info("Lead {} {} → {} by buyer {}", leadId, lead.status().wireName(), newStatus.wireName(), buyer.userId());
        return updated;
    }

    private static boolean isParty(Actor actor, Lead lead) {
        return (actor.isProvider() && lead.providerId().equals(actor.userId()))
            || (actor.isBuyer() && lead.buyerId().equals(actor.userId()));
    }

    private Lead load(String leadId) {
        return leads.findById(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));
    }
}
