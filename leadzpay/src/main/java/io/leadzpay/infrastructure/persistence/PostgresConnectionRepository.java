package io.leadzpay.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leadzpay.application.port.output.ConnectionRepository;
import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.connection.ConnectionStatus;
import io.leadzpay.domain.connection.ContractTerms;
import io.leadzpay.domain.connection.DuplicateConnectionException;
import io.leadzpay.domain.user.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class PostgresConnectionRepository implements ConnectionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresConnectionRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String NON_TERMINAL = "('pending_buyer_review', 'pending_provider_accept', 'active')";

    private final DataSource dataSource;

    public PostgresConnectionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(Connection connection) {
        String sql = """
            INSERT INTO connections (
                id, provider_id, buyer_id, initiator, message, status, terms,
                total_leads, total_paid, last_lead_at,
                created_at, terms_set_at, terms_updated_at, accepted_at, responded_at,
                terminated_at, terminated_by, termination_reason, version
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (java.sql.Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, connection.id());
            ps.setString(2, connection.providerId());
            ps.setString(3, connection.buyerId());
            ps.setString(4, connection.initiator().wireName());
            ps.setString(5, connection.message());
            ps.setString(6, connection.status().wireName());
            ps.setString(7, toJson(connection.terms()));
            ps.setInt(8, connection.totalLeads());
            ps.setBigDecimal(9, connection.totalPaid());
            ps.setTimestamp(10, ts(connection.lastLeadAt()));
            ps.setTimestamp(11, ts(connection.createdAt()));
            ps.setTimestamp(12, ts(connection.termsSetAt()));
            ps.setTimestamp(13, ts(connection.termsUpdatedAt()));
            ps.setTimestamp(14, ts(connection.acceptedAt()));
            ps.setTimestamp(15, ts(connection.respondedAt()));
            ps.setTimestamp(16, ts(connection.terminatedAt()));
            ps.setString(17, connection.terminatedBy() != null ? connection.terminatedBy().wireName() : null);
            ps.setString(18, connection.terminationReason());
            ps.setLong(19, connection.version());

            ps.executeUpdate();
            log.info("Connection inserted: {} version {}", connection.id(), connection.version());

        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                // Lost the race against another process creating the same pair
                throw new DuplicateConnectionException(connection.providerId(), connection.buyerId(), null);
            }
            log.error("Error inserting connection {}: {}", connection.id(), e.getMessage(), e);
            throw new RuntimeException("Failed to insert connection " + connection.id(), e);
        }
    }

    @Override
    public Optional<Connection> findById(String connectionId) {
        List<Connection> found = query("SELECT * FROM connections WHERE id = ?", connectionId);
        return found.stream().findFirst();
    }

    @Override
    public Optional<Connection> findNonTerminalByPair(String providerId, String buyerId) {
        String sql = "SELECT * FROM connections WHERE provider_id = ? AND buyer_id = ? AND status IN "
            + NON_TERMINAL + " ORDER BY created_at DESC LIMIT 1";
        return query(sql, providerId, buyerId).stream().findFirst();
    }

    @Override
    public List<Connection> findByProvider(String providerId) {
        return query("SELECT * FROM connections WHERE provider_id = ? ORDER BY created_at DESC, id", providerId);
    }

    @Override
    public List<Connection> findByBuyer(String buyerId) {
        return query("SELECT * FROM connections WHERE buyer_id = ? ORDER BY created_at DESC, id", buyerId);
    }

    @Override
    public List<Connection> findActiveByProvider(String providerId) {
        return query("SELECT * FROM connections WHERE provider_id = ? AND status = 'active' ORDER BY created_at DESC, id",
            providerId);
    }

    @Override
    public boolean update(Connection connection, long expectedVersion) {
        try (java.sql.Connection conn = dataSource.getConnection()) {
            boolean updated = update(conn, connection, expectedVersion);
            if (updated) {
                log.debug("Connection updated: {} version {}", connection.id(), connection.version());
            }
            return updated;
        } catch (SQLException e) {
            log.error("Error updating connection {}: {}", connection.id(), e.getMessage(), e);
            throw new RuntimeException("Failed to update connection " + connection.id(), e);
        }
    }

    /**
     * Version-guarded update on a caller-owned JDBC connection, so it can join a transaction.
     */
    static boolean update(java.sql.Connection conn, Connection connection, long expectedVersion) throws SQLException {
        String sql = """
            UPDATE connections SET
                status = ?, terms = ?::jsonb,
                total_leads = ?, total_paid = ?, last_lead_at = ?,
                terms_set_at = ?, terms_updated_at = ?, accepted_at = ?, responded_at = ?,
                terminated_at = ?, terminated_by = ?, termination_reason = ?,
                version = ?
            WHERE id = ? AND version = ?
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, connection.status().wireName());
            ps.setString(2, toJson(connection.terms()));
            ps.setInt(3, connection.totalLeads());
            ps.setBigDecimal(4, connection.totalPaid());
            ps.setTimestamp(5, ts(connection.lastLeadAt()));
            ps.setTimestamp(6, ts(connection.termsSetAt()));
            ps.setTimestamp(7, ts(connection.termsUpdatedAt()));
            ps.setTimestamp(8, ts(connection.acceptedAt()));
            ps.setTimestamp(9, ts(connection.respondedAt()));
            ps.setTimestamp(10, ts(connection.terminatedAt()));
            ps.setString(11, connection.terminatedBy() != null ? connection.terminatedBy().wireName() : null);
            ps.setString(12, connection.terminationReason());
            ps.setLong(13, connection.version());
            ps.setString(14, connection.id());
            ps.setLong(15, expectedVersion);

            return ps.executeUpdate() == 1;
        }
    }

    private List<Connection> query(String sql, String... params) {
        List<Connection> connections = new ArrayList<>();

        try (java.sql.Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    connections.add(mapRow(rs));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error querying connections: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to query connections", e);
        }

        return connections;
    }

    private Connection mapRow(ResultSet rs) throws SQLException, JsonProcessingException {
        String termsJson = rs.getString("terms");
        ContractTerms terms = termsJson != null ? MAPPER.readValue(termsJson, ContractTerms.class) : null;
        String terminatedBy = rs.getString("terminated_by");

        return new Connection(
            rs.getString("id"),
            rs.getString("provider_id"),
            rs.getString("buyer_id"),
            Role.fromWire(rs.getString("initiator")),
            rs.getString("message"),
            ConnectionStatus.fromWire(rs.getString("status")),
            terms,
            rs.getInt("total_leads"),
            rs.getBigDecimal("total_paid"),
            instant(rs, "last_lead_at"),
            instant(rs, "created_at"),
            instant(rs, "terms_set_at"),
            instant(rs, "terms_updated_at"),
            instant(rs, "accepted_at"),
            instant(rs, "responded_at"),
            instant(rs, "terminated_at"),
            terminatedBy != null ? Role.fromWire(terminatedBy) : null,
            rs.getString("termination_reason"),
            rs.getLong("version")
        );
    }

    private static String toJson(ContractTerms terms) throws SQLException {
        if (terms == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(terms);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot serialize contract terms", e);
        }
    }

    static Timestamp ts(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
