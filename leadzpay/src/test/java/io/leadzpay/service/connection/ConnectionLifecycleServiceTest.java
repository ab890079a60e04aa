package io.leadzpay.service.connection;

import io.leadzpay.application.port.output.ConnectionRepository;
import io.leadzpay.application.service.ConnectionCoordinator;
import io.leadzpay.domain.common.ErrorCode;
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
import io.leadzpay.domain.connection.InvalidTermsException;
import io.leadzpay.domain.connection.InvalidTransitionException;
import io.leadzpay.domain.user.Actor;
import io.leadzpay.domain.user.Role;
import io.leadzpay.infrastructure.metrics.MarketplaceMetrics;
import io.leadzpay.infrastructure.persistence.InMemoryConnectionRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConnectionLifecycleService.
 *
 * Tests:
 * - Request and invite flows to active
 * - Role and party checks before status checks
 * - Terminal states and duplicate pairs
 * - Exclusivity (advisory and enforced)
 * - Version conflicts
 */
class ConnectionLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-11T10:00:00Z");
    private static final ContractTerms TERMS = ContractTerms.ofRate(new BigDecimal("40"));

    private final Actor provider = Actor.provider("prov-1");
    private final Actor buyer = Actor.buyer("buyer-1");
    private final Actor otherBuyer = Actor.buyer("buyer-2");

    private InMemoryConnectionRepository repo;
    private ConnectionCoordinator coordinator;
    private MarketplaceMetrics metrics;
    private ConnectionLifecycleService service;

    @BeforeEach
    void setUp() {
        repo = new InMemoryConnectionRepository();
        coordinator = new ConnectionCoordinator(2);
        metrics = mock(MarketplaceMetrics.class);
        service = newService(repo, false);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private ConnectionLifecycleService newService(ConnectionRepository connections, boolean enforceExclusivity) {
        return new ConnectionLifecycleService(
            connections,
            coordinator,
            new TermsValidator(new BigDecimal("5"), new BigDecimal("500")),
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC),
            enforceExclusivity);
    }

    private Connection activeConnection(Actor p, Actor b, ContractTerms terms) {
        Connection requested = service.requestConnection(p, b.userId(), null);
        service.setTerms(b, requested.id(), terms);
        return service.accept(p, requested.id());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Happy paths
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testProviderRequestFlow() {
        Connection requested = service.requestConnection(provider, buyer.userId(), "Hi, I sell auto leads");

        assertTrue(requested.id().startsWith("conn_"));
        assertEquals(ConnectionStatus.PENDING_BUYER_REVIEW, requested.status());
        assertEquals(Role.PROVIDER, requested.initiator());
        assertNull(requested.terms());
        assertEquals(0, requested.version());

        Connection termsSet = service.setTerms(buyer, requested.id(), TERMS);
        assertEquals(ConnectionStatus.PENDING_PROVIDER_ACCEPT, termsSet.status());
        assertEquals(NOW, termsSet.termsSetAt());
        assertEquals(1, termsSet.version());

        Connection active = service.accept(provider, requested.id());
        assertEquals(ConnectionStatus.ACTIVE, active.status());
        assertEquals(NOW, active.acceptedAt());
        assertEquals(new BigDecimal("40"), active.terms().ratePerLead());
        assertEquals(2, active.version());

        assertEquals(active, repo.findById(requested.id()).orElseThrow());
        verify(metrics).recordTransition("request");
        verify(metrics).recordTransition("set_terms");
        verify(metrics).recordTransition("accept");
    }

    @Test
    void testBuyerInviteFlow() {
        Connection invited = service.inviteProvider(buyer, provider.userId(), TERMS, "Join us");

        assertEquals(ConnectionStatus.PENDING_PROVIDER_ACCEPT, invited.status());
        assertEquals(Role.BUYER, invited.initiator());
        assertEquals(NOW, invited.termsSetAt());

        Connection active = service.accept(provider, invited.id());
        assertEquals(ConnectionStatus.ACTIVE, active.status());
        verify(metrics).recordTransition("invite");
    }

    @Test
    void testInviteWithInvalidTermsStoresNothing() {
        assertThrows(InvalidTermsException.class,
            () -> service.inviteProvider(buyer, provider.userId(), ContractTerms.ofRate(new BigDecimal("1000")), null));

        assertTrue(repo.findByBuyer(buyer.userId()).isEmpty());
    }

    @Test
    void testRejectAndDeclineAreTerminal() {
        Connection rejected = service.requestConnection(provider, buyer.userId(), null);
        assertEquals(ConnectionStatus.REJECTED_BY_BUYER, service.reject(buyer, rejected.id()).status());

        Connection declined = service.inviteProvider(otherBuyer, provider.userId(), TERMS, null);
        assertEquals(ConnectionStatus.DECLINED_BY_PROVIDER, service.decline(provider, declined.id()).status());

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
            () -> service.setTerms(buyer, rejected.id(), TERMS));
        assertEquals(ConnectionStatus.REJECTED_BY_BUYER, e.getCurrentStatus());
        assertEquals(ConnectionAction.SET_TERMS, e.getAction());
    }

    @Test
    void testEitherPartyCanTerminate() {
        Connection first = activeConnection(provider, buyer, TERMS);
        Connection terminated = service.terminate(buyer, first.id(), "Budget cut");

        assertEquals(ConnectionStatus.TERMINATED, terminated.status());
        assertEquals(Role.BUYER, terminated.terminatedBy());
        assertEquals("Budget cut", terminated.terminationReason());
        assertEquals(NOW, terminated.terminatedAt());

        Connection second = activeConnection(provider, otherBuyer, TERMS);
        assertEquals(Role.PROVIDER, service.terminate(provider, second.id(), null).terminatedBy());
    }

    @Test
    void testTerminatedConnectionIsFinal() {
        Connection active = activeConnection(provider, buyer, TERMS);
        service.terminate(provider, active.id(), null);

        assertThrows(InvalidTransitionException.class, () -> service.terminate(buyer, active.id(), null));
        assertThrows(InvalidTransitionException.class,
            () -> service.updateTerms(buyer, active.id(), ContractTerms.ofRate(new BigDecimal("60"))));
    }

    @Test
    void testUpdateTermsKeepsActive() {
        Connection active = activeConnection(provider, buyer, TERMS);

        Connection updated = service.updateTerms(buyer, active.id(), ContractTerms.ofRate(new BigDecimal("75")));

        assertEquals(ConnectionStatus.ACTIVE, updated.status());
        assertEquals(new BigDecimal("75"), updated.terms().ratePerLead());
        assertEquals(NOW, updated.termsUpdatedAt());
        assertEquals(active.acceptedAt(), updated.acceptedAt());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Authorization
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testWrongRoleRejectedBeforeStatusCheck() {
        Connection requested = service.requestConnection(provider, buyer.userId(), null);

        // Provider tries a buyer action: access, not transition
        ConnectionAccessException e = assertThrows(ConnectionAccessException.class,
            () -> service.setTerms(provider, requested.id(), TERMS));
        assertEquals(ErrorCode.ACCESS_DENIED, e.getCode());

        // Provider accept while pending buyer review: right role, wrong status
        assertThrows(InvalidTransitionException.class, () -> service.accept(provider, requested.id()));
    }

    @Test
    void testNonPartyRejected() {
        Connection requested = service.requestConnection(provider, buyer.userId(), null);

        assertThrows(ConnectionAccessException.class, () -> service.setTerms(otherBuyer, requested.id(), TERMS));
        assertThrows(ConnectionAccessException.class, () -> service.get(otherBuyer, requested.id()));
    }

    @Test
    void testAdminCannotTerminate() {
        Connection active = activeConnection(provider, buyer, TERMS);

        assertThrows(ConnectionAccessException.class,
            () -> service.terminate(Actor.admin("ops"), active.id(), null));
    }

    @Test
    void testOnlyProvidersRequestAndOnlyBuyersInvite() {
        assertThrows(ConnectionAccessException.class,
            () -> service.requestConnection(buyer, "buyer-9", null));
        assertThrows(ConnectionAccessException.class,
            () -> service.inviteProvider(provider, "prov-9", TERMS, null));
    }

    @Test
    void testMissingCounterpartyId() {
        assertThrows(InvalidRequestException.class, () -> service.requestConnection(provider, " ", null));
    }

    @Test
    void testUnknownConnection() {
        ConnectionNotFoundException e = assertThrows(ConnectionNotFoundException.class,
            () -> service.accept(provider, "conn_missing"));
        assertEquals(ErrorCode.CONNECTION_NOT_FOUND, e.getCode());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Pair uniqueness
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testDuplicatePairRejected() {
        Connection first = service.requestConnection(provider, buyer.userId(), null);

        DuplicateConnectionException e = assertThrows(DuplicateConnectionException.class,
            () -> service.inviteProvider(buyer, provider.userId(), TERMS, null));
        assertEquals(first.id(), e.getExistingConnectionId());
    }

    @Test
    void testNewRequestAllowedAfterTerminalState() {
        Connection first = service.requestConnection(provider, buyer.userId(), null);
        service.reject(buyer, first.id());

        Connection second = service.requestConnection(provider, buyer.userId(), "Second try");
        assertNotEquals(first.id(), second.id());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Exclusivity
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testExclusivityIsAdvisoryByDefault() {
        activeConnection(provider, buyer, TERMS.withExclusivity(true));

        Connection second = activeConnection(provider, otherBuyer, TERMS);

        assertEquals(ConnectionStatus.ACTIVE, second.status());
        assertEquals(2, repo.findActiveByProvider(provider.userId()).size());
    }

    @Test
    void testExclusivityEnforcedWhenConfigured() {
        service = newService(repo, true);
        Connection exclusive = activeConnection(provider, buyer, TERMS.withExclusivity(true));
        Connection pending = service.inviteProvider(otherBuyer, provider.userId(), TERMS, null);

        ExclusivityConflictException e = assertThrows(ExclusivityConflictException.class,
            () -> service.accept(provider, pending.id()));

        assertEquals(ErrorCode.EXCLUSIVITY_CONFLICT, e.getCode());
        assertTrue(e.getMessage().contains(exclusive.id()));
        assertEquals(ConnectionStatus.PENDING_PROVIDER_ACCEPT, repo.findById(pending.id()).orElseThrow().status());
    }

    @Test
    void testConcurrentExclusiveAcceptsLeaveOneActive() throws Exception {
        service = newService(repo, true);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 20; round++) {
                Actor p = Actor.provider("prov-race-" + round);
                Connection first = service.inviteProvider(buyer, p.userId(), TERMS.withExclusivity(true), null);
                Connection second = service.inviteProvider(otherBuyer, p.userId(), TERMS.withExclusivity(true), null);

                CountDownLatch go = new CountDownLatch(1);
                Callable<Boolean> acceptFirst = () -> tryAccept(go, p, first.id());
                Callable<Boolean> acceptSecond = () -> tryAccept(go, p, second.id());
                List<Future<Boolean>> results = List.of(pool.submit(acceptFirst), pool.submit(acceptSecond));
                go.countDown();

                int accepted = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(5, TimeUnit.SECONDS)) {
                        accepted++;
                    }
                }
                assertEquals(1, accepted);
                assertEquals(1, repo.findActiveByProvider(p.userId()).size());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private boolean tryAccept(CountDownLatch go, Actor p, String connectionId) throws InterruptedException {
        go.await();
        try {
            service.accept(p, connectionId);
            return true;
        } catch (ExclusivityConflictException e) {
            return false;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testListForActorFilters() {
        Connection waitingOnBuyer = service.requestConnection(provider, buyer.userId(), null);
        Connection waitingOnProvider = service.inviteProvider(otherBuyer, provider.userId(), TERMS, null);
        Connection active = activeConnection(Actor.provider("prov-2"), buyer, TERMS);

        assertEquals(2, service.listForActor(buyer, ConnectionFilter.ALL).size());
        assertEquals(List.of(waitingOnBuyer), service.listForActor(buyer, ConnectionFilter.PENDING));
        assertEquals(List.of(active.id()),
            service.listForActor(buyer, ConnectionFilter.ACTIVE).stream().map(Connection::id).toList());
        assertEquals(List.of(waitingOnProvider), service.listForActor(provider, ConnectionFilter.PENDING));
    }

    @Test
    void testAdminGetsByIdButCannotList() {
        Connection requested = service.requestConnection(provider, buyer.userId(), null);
        Actor admin = Actor.admin("ops");

        assertEquals(requested, service.get(admin, requested.id()));
        assertThrows(ConnectionAccessException.class, () -> service.listForActor(admin, ConnectionFilter.ALL));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Concurrency
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testVersionConflictSurfaces() {
        Connection requested = Connection.requested("conn_x", provider.userId(), buyer.userId(), null, NOW);
        ConnectionRepository stale = mock(ConnectionRepository.class);
        when(stale.findById("conn_x")).thenReturn(Optional.of(requested));
        when(stale.update(any(Connection.class), anyLong())).thenReturn(false);

        ConnectionLifecycleService racing = newService(stale, false);

        ConcurrentConnectionUpdateException e = assertThrows(ConcurrentConnectionUpdateException.class,
            () -> racing.reject(buyer, "conn_x"));
        assertEquals(ErrorCode.CONCURRENT_UPDATE, e.getCode());
        verify(stale).update(any(Connection.class), eq(0L));
        verify(metrics, never()).recordTransition(anyString());
    }
}
