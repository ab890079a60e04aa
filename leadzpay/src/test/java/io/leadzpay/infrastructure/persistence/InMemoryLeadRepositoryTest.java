package io.leadzpay.infrastructure.persistence;

import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.lead.CustomerContact;
import io.leadzpay.domain.lead.Lead;
import io.leadzpay.domain.lead.LeadStatus;
import io.leadzpay.domain.lead.QuoteType;
import io.leadzpay.domain.rating.VehicleDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLeadRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-06-09T00:00:00Z");
    private static final BigDecimal RATE = new BigDecimal("40");

    private InMemoryConnectionRepository connections;
    private InMemoryLeadRepository leads;

    @BeforeEach
    void setUp() {
        connections = new InMemoryConnectionRepository();
        leads = new InMemoryLeadRepository(connections);
        connections.insert(Connection.requested("conn_1", "prov-1", "buyer-1", null, T0));
    }

    private static Lead lead(String id, Instant submittedAt) {
        return new Lead(id, "conn_1", "prov-1", "buyer-1",
            new CustomerContact("Jane Doe", "jane@example.com", null, null),
            "Honda Civic", new VehicleDescriptor(2025, "Honda", "Civic"), QuoteType.QUOTE,
            LeadStatus.PENDING, RATE, null, submittedAt, null, submittedAt);
    }

    private boolean record(Lead lead) {
        Connection current = connections.findById("conn_1").orElseThrow();
        return leads.recordSubmission(lead, current.withLeadRecorded(RATE, lead.submittedAt()), current.version());
    }

    @Test
    void testRecordSubmissionUpdatesConnection() {
        assertTrue(record(lead("lead_1", T0)));

        Connection after = connections.findById("conn_1").orElseThrow();
        assertEquals(1, after.totalLeads());
        assertEquals(1, after.version());
        assertTrue(leads.findById("lead_1").isPresent());
    }

    @Test
    void testStaleVersionStoresNothing() {
        Connection current = connections.findById("conn_1").orElseThrow();
        assertTrue(record(lead("lead_1", T0)));

        boolean stored = leads.recordSubmission(lead("lead_2", T0),
            current.withLeadRecorded(RATE, T0), current.version());

        assertFalse(stored);
        assertTrue(leads.findById("lead_2").isEmpty());
        assertEquals(1, connections.findById("conn_1").orElseThrow().totalLeads());
    }

    @Test
    void testCountSinceIsInclusive() {
        record(lead("lead_1", T0.minusSeconds(1)));
        record(lead("lead_2", T0));
        record(lead("lead_3", T0.plus(Duration.ofDays(2))));

        assertEquals(2, leads.countByConnectionSince("conn_1", T0));
        assertEquals(0, leads.countByConnectionSince("conn_other", T0));
    }

    @Test
    void testListsNewestFirst() {
        record(lead("lead_old", T0));
        record(lead("lead_new", T0.plusSeconds(60)));

        assertEquals("lead_new", leads.findByBuyer("buyer-1").get(0).id());
        assertEquals("lead_old", leads.findByProvider("prov-1").get(1).id());
    }

    @Test
    void testUpdateStatusRequiresExistingLead() {
        assertThrows(IllegalStateException.class,
            () -> leads.updateStatus(lead("lead_missing", T0).withStatus(LeadStatus.CLAIMED, T0), LeadStatus.PENDING));
    }

    @Test
    void testUpdateStatusChecksStoredStatus() {
        Lead pending = lead("lead_1", T0);
        record(pending);
        Lead claimed = pending.withStatus(LeadStatus.CLAIMED, T0);
        assertTrue(leads.updateStatus(claimed, LeadStatus.PENDING));

        assertTrue(leads.updateStatus(claimed.withStatus(LeadStatus.CONVERTED, T0), LeadStatus.CLAIMED));
        assertFalse(leads.updateStatus(claimed.withStatus(LeadStatus.REJECTED, T0), LeadStatus.CLAIMED));

        assertEquals(LeadStatus.CONVERTED, leads.findById("lead_1").orElseThrow().status());
    }
}
