package io.leadzpay.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leadzpay.application.port.output.LeadRepository;
import io.leadzpay.domain.connection.Connection;
import io.leadzpay.domain.lead.CustomerContact;
import io.leadzpay.domain.lead.Lead;
import io.leadzpay.domain.lead.LeadStatus;
import io.leadzpay.domain.lead.QuoteType;
import io.leadzpay.domain.lead.SelectedQuote;
import io.leadzpay.domain.rating.VehicleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static io.leadzpay.infrastructure.persistence.PostgresConnectionRepository.instant;
import static io.leadzpay.infrastructure.persistence.PostgresConnectionRepository.ts;

public final class PostgresLeadRepository implements LeadRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresLeadRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public PostgresLeadRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Lead> findById(String leadId) {
        return query("SELECT * FROM leads WHERE id = ?", leadId).stream().findFirst();
    }

    @Override
    public List<Lead> findByProvider(String providerId) {
        return query("SELECT * FROM leads WHERE provider_id = ? ORDER BY submitted_at DESC, id", providerId);
    }

    @Override
    public List<Lead> findByBuyer(String buyerId) {
        return query("SELECT * FROM leads WHERE buyer_id = ? ORDER BY submitted_at DESC, id", buyerId);
    }

    @Override
    public int countByConnectionSince(String connectionId, Instant since) {
        String sql = "SELECT COUNT(*) FROM leads WHERE connection_id = ? AND submitted_at >= ?";

        try (java.sql.Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, connectionId);
            ps.setTimestamp(2, ts(since));

            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            log.error("Error counting leads for connection {}: {}", connectionId, e.getMessage(), e);
            throw new RuntimeException("Failed to count leads for connection " + connectionId, e);
        }
    }

    @Override
    public boolean recordSubmission(Lead lead, Connection updatedConnection, long expectedVersion) {
        String insertSql = """
            INSERT INTO leads (
                id, connection_id, provider_id, buyer_id,
                customer_name, customer_email, customer_phone, customer_state,
                car_model, vehicle_year, vehicle_make, vehicle_model,
                quote_type, status, payout, selected_quote,
                submitted_at, claimed_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            """;

        try (java.sql.Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (!PostgresConnectionRepository.update(conn, updatedConnection, expectedVersion)) {
                    conn.rollback();
                    return false;
                }

                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    CustomerContact customer = lead.customer();
                    VehicleDescriptor vehicle = lead.vehicle();

                    ps.setString(1, lead.id());
                    ps.setString(2, lead.connectionId());
                    ps.setString(3, lead.providerId());
                    ps.setString(4, lead.buyerId());
                    ps.setString(5, customer != null ? customer.name() : null);
                    ps.setString(6, customer != null ? customer.email() : null);
                    ps.setString(7, customer != null ? customer.phone() : null);
                    ps.setString(8, customer != null ? customer.state() : null);
                    ps.setString(9, lead.carModel());
                    ps.setObject(10, vehicle != null ? vehicle.year() : null);
                    ps.setString(11, vehicle != null ? vehicle.make() : null);
                    ps.setString(12, vehicle != null ? vehicle.model() : null);
                    ps.setString(13, lead.quoteType() != null ? lead.quoteType().wireName() : null);
                    ps.setString(14, lead.status().wireName());
                    ps.setBigDecimal(15, lead.payout());
                    ps.setString(16, lead.selectedQuote() != null ? MAPPER.writeValueAsString(lead.selectedQuote()) : null);
                    ps.setTimestamp(17, ts(lead.submittedAt()));
                    ps.setTimestamp(18, ts(lead.claimedAt()));
                    ps.setTimestamp(19, ts(lead.updatedAt()));
                    ps.executeUpdate();
                }

                conn.commit();
                log.info("Lead recorded: {} on connection {} (payout {})",
                    lead.id(), lead.connectionId(), lead.payout());
                return true;

            } catch (SQLException | JsonProcessingException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error recording lead {}: {}", lead.id(), e.getMessage(), e);
            throw new RuntimeException("Failed to record lead " + lead.id(), e);
        }
    }

    @Override
    public boolean updateStatus(Lead lead, LeadStatus expectedStatus) {
        String sql = "UPDATE leads SET status = ?, claimed_at = ?, updated_at = ? WHERE id = ? AND status = ?";

        try (java.sql.Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, lead.status().wireName());
            ps.setTimestamp(2, ts(lead.claimedAt()));
            ps.setTimestamp(3, ts(lead.updatedAt()));
            ps.setString(4, lead.id());
            ps.setString(5, expectedStatus.wireName());

            if (ps.executeUpdate() == 0) {
                log.warn("Lead {} no longer {}; status change to {} not applied",
                    lead.id(), expectedStatus.wireName(), lead.status().wireName());
                return false;
            }
            log.info("Lead {} status {} -> {}", lead.id(), expectedStatus.wireName(), lead.status().wireName());
            return true;

        } catch (SQLException e) {
            log.error("Error updating lead {}: {}", lead.id(), e.getMessage(), e);
            throw new RuntimeException("Failed to update lead " + lead.id(), e);
        }
    }

    private List<Lead> query(String sql, String param) {
        List<Lead> leads = new ArrayList<>();

        try (java.sql.Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    leads.add(mapRow(rs));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error querying leads: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to query leads", e);
        }

        return leads;
    }

    private Lead mapRow(ResultSet rs) throws SQLException, JsonProcessingException {
        String quoteJson = rs.getString("selected_quote");
        String quoteType = rs.getString("quote_type");
        int year = rs.getInt("vehicle_year");
        VehicleDescriptor vehicle = rs.wasNull()
            ? null
            : new VehicleDescriptor(year, rs.getString("vehicle_make"), rs.getString("vehicle_model"));

        return new Lead(
            rs.getString("id"),
            rs.getString("connection_id"),
            rs.getString("provider_id"),
            rs.getString("buyer_id"),
            new CustomerContact(
                rs.getString("customer_name"),
                rs.getString("customer_email"),
                rs.getString("customer_phone"),
                rs.getString("customer_state")),
            rs.getString("car_model"),
            vehicle,
            quoteType != null ? QuoteType.valueOf(quoteType.toUpperCase(Locale.ROOT)) : null,
            LeadStatus.fromWire(rs.getString("status")),
            rs.getBigDecimal("payout"),
            quoteJson != null ? MAPPER.readValue(quoteJson, SelectedQuote.class) : null,
            instant(rs, "submitted_at"),
            instant(rs, "claimed_at"),
            instant(rs, "updated_at")
        );
    }
}
