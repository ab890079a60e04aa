package io.leadzpay.infrastructure.persistence;

import io.leadzpay.application.port.output.ConnectionRepository;
import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.connection.ConnectionStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Connection store for LEADZPAY_STORAGE=memory and tests.
 *
 * Version checks and writes run under the instance monitor, which InMemoryLeadRepository
 * shares to make lead submissions atomic.
 */
public final class InMemoryConnectionRepository implements ConnectionRepository {

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    @Override
    public synchronized void insert(Connection connection) {
        if (connections.putIfAbsent(connection.id(), connection) != null) {
            throw new IllegalStateException("Connection already exists: " + connection.id());
        }
    }

    @Override
    public Optional<Connection> findById(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    @Override
    public Optional<Connection> findNonTerminalByPair(String providerId, String buyerId) {
        return select(c -> c.providerId().equals(providerId)
            && c.buyerId().equals(buyerId)
            && !c.status().isTerminal()).stream().findFirst();
    }

    @Override
    public List<Connection> findByProvider(String providerId) {
        return select(c -> c.providerId().equals(providerId));
    }

    @Override
    public List<Connection> findByBuyer(String buyerId) {
        return select(c -> c.buyerId().equals(buyerId));
    }

    @Override
    public List<Connection> findActiveByProvider(String providerId) {
        return select(c -> c.providerId().equals(providerId) && c.status() == ConnectionStatus.ACTIVE);
    }

    @Override
    public synchronized boolean update(Connection connection, long expectedVersion) {
        Connection current = connections.get(connection.id());
        if (current == null || current.version() != expectedVersion) {
            return false;
        }
        connections.put(connection.id(), connection);
        return true;
    }

    // Newest first, matching the PostgreSQL adapter
    private List<Connection> select(Predicate<Connection> filter) {
        return connections.values().stream()
            .filter(filter)
            .sorted(Comparator.comparing(Connection::createdAt).reversed().thenComparing(Connection::id))
            .toList();
    }
}
