package io.leadzpay.application.port.output;

import io.leadzpay.domain.connection.Connection;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for connections.
 *
 * Writes are guarded by the connection version: update succeeds only when the stored
 * version equals the expected one.
 */
public interface ConnectionRepository {
    void insert(Connection connection);

    Optional<Connection> findById(String connectionId);

    /**
     * Pending or active connection for the pair, if any.
     */
    Optional<Connection> findNonTerminalByPair(String providerId, String buyerId);

    List<Connection> findByProvider(String providerId);

    List<Connection> findByBuyer(String buyerId);

    List<Connection> findActiveByProvider(String providerId);

    /**
     * @return false when the stored version no longer matches expectedVersion
     */
    boolean update(Connection connection, long expectedVersion);
}
