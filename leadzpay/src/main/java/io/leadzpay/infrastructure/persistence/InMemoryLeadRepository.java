package io.leadzpay.infrastructure.persistence;

import io.leadzpay.application.port.output.LeadRepository;
import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.lead.Lead;
import io.leadzpay.domain.lead.LeadStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Lead store paired with an InMemoryConnectionRepository.
 */
public final class InMemoryLeadRepository implements LeadRepository {

    private final Map<String, Lead> leads = new ConcurrentHashMap<>();
    private final InMemoryConnectionRepository connections;

    public InMemoryLeadRepository(InMemoryConnectionRepository connections) {
        this.connections = connections;
    }

    @Override
    public Optional<Lead> findById(String leadId) {
        return Optional.ofNullable(leads.get(leadId));
    }

    @Override
    public List<Lead> findByProvider(String providerId) {
        return select(l -> l.providerId().equals(providerId));
    }

    @Override
    public List<Lead> findByBuyer(String buyerId) {
        return select(l -> l.buyerId().equals(buyerId));
    }

    @Override
    public int countByConnectionSince(String connectionId, Instant since) {
        return (int) leads.values().stream()
            .filter(l -> connectionId.equals(l.connectionId()))
            .filter(l -> !l.submittedAt().isBefore(since))
            .count();
    }

    @Override
    public boolean recordSubmission(Lead lead, Connection updatedConnection, long expectedVersion) {
        synchronized (connections) {
            if (!connections.update(updatedConnection, expectedVersion)) {
                return false;
            }
            leads.put(lead.id(), lead);
            return true;
        }
    }

    @Override
    public boolean updateStatus(Lead lead, LeadStatus expectedStatus) {
        Lead current = leads.get(lead.id());
        if (current == null) {
            throw new IllegalStateException("Lead not found: " + lead.id());
        }
        return current.status() == expectedStatus && leads.replace(lead.id(), current, lead);
    }

    private List<Lead> select(Predicate<Lead> filter) {
        return leads.values().stream()
            .filter(filter)
            .sorted(Comparator.comparing(Lead::submittedAt).reversed().thenComparing(Lead::id))
            .toList();
    }
}
