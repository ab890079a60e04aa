package io.leadzpay.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema Migration - Creates the marketplace tables on startup.
 *
 * Creates two tables:
 * - connections: provider/buyer relationships, terms (JSONB) and running totals
 * - leads: submitted leads; cap windows are counted from (connection_id, submitted_at)
 *
 * Idempotent: existing tables are left alone.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Starting marketplace schema migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "connections")) {
                log.info("[MIGRATION] Creating connections table...");
                createConnectionsTable(conn);
                log.info("[MIGRATION] ✓ connections table created");
            } else {
                log.info("[MIGRATION] connections table already exists");
            }

            if (!tableExists(conn, "leads")) {
                log.info("[MIGRATION] Creating leads table...");
                createLeadsTable(conn);
                log.info("[MIGRATION] ✓ leads table created");
            } else {
                log.info("[MIGRATION] leads table already exists");
            }

            log.info("[MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createConnectionsTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE connections (
                id VARCHAR(64) PRIMARY KEY,
                provider_id VARCHAR(64) NOT NULL,
                buyer_id VARCHAR(64) NOT NULL,
                initiator VARCHAR(16) NOT NULL,
                message TEXT,
                status VARCHAR(32) NOT NULL,
                terms JSONB,

                -- Running totals
                total_leads INT NOT NULL DEFAULT 0,
                total_paid NUMERIC(12,2) NOT NULL DEFAULT 0,
                last_lead_at TIMESTAMPTZ,

                -- Lifecycle
                created_at TIMESTAMPTZ NOT NULL,
                terms_set_at TIMESTAMPTZ,
                terms_updated_at TIMESTAMPTZ,
                accepted_at TIMESTAMPTZ,
                responded_at TIMESTAMPTZ,
                terminated_at TIMESTAMPTZ,
                terminated_by VARCHAR(16),
                termination_reason TEXT,

                version BIGINT NOT NULL DEFAULT 0
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_connections_provider ON connections(provider_id)");
            stmt.execute("CREATE INDEX idx_connections_buyer ON connections(buyer_id)");
            // At most one pending or active connection per pair
            stmt.execute("""
                CREATE UNIQUE INDEX uq_connections_open_pair ON connections(provider_id, buyer_id)
                WHERE status IN ('pending_buyer_review', 'pending_provider_accept', 'active')
                """);
        }
    }

    private void createLeadsTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE leads (
                id VARCHAR(64) PRIMARY KEY,
                connection_id VARCHAR(64) NOT NULL REFERENCES connections(id),
                provider_id VARCHAR(64) NOT NULL,
                buyer_id VARCHAR(64) NOT NULL,

                -- Customer
                customer_name VARCHAR(200),
                customer_email VARCHAR(200),
                customer_phone VARCHAR(50),
                customer_state VARCHAR(2),

                -- Vehicle
                car_model VARCHAR(200),
                vehicle_year INT,
                vehicle_make VARCHAR(200),
                vehicle_model VARCHAR(200),

                quote_type VARCHAR(16),
                status VARCHAR(16) NOT NULL,
                payout NUMERIC(12,2) NOT NULL,
                selected_quote JSONB,

                submitted_at TIMESTAMPTZ NOT NULL,
                claimed_at TIMESTAMPTZ,
                updated_at TIMESTAMPTZ NOT NULL
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_leads_connection_submitted ON leads(connection_id, submitted_at)");
            stmt.execute("CREATE INDEX idx_leads_provider ON leads(provider_id)");
            stmt.execute("CREATE INDEX idx_leads_buyer ON leads(buyer_id)");
        }
    }
}
