package io.leadzpay.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.leadzpay.application.port.output.ConnectionRepository;
import io.leadzpay.application.port.output.LeadRepository;
import io.leadzpay.application.service.ConnectionCoordinator;
import io.leadzpay.config.MarketplaceConfig;
import io.leadzpay.config.StorageMode;
import io.leadzpay.infrastructure.metrics.PrometheusMarketplaceMetrics;
import io.leadzpay.infrastructure.metrics.PrometheusMetricsHandler;
import io.leadzpay.infrastructure.persistence.InMemoryConnectionRepository;
import io.leadzpay.infrastructure.persistence.InMemoryLeadRepository;
import io.leadzpay.infrastructure.persistence.PostgresConnectionRepository;
import io.leadzpay.infrastructure.persistence.PostgresLeadRepository;
import io.leadzpay.migration.SchemaMigration;
import io.leadzpay.service.connection.ConnectionLifecycleService;
import io.leadzpay.service.connection.TermsValidator;
import io.leadzpay.service.lead.CapWindows;
import io.leadzpay.service.lead.LeadLedger;
import io.leadzpay.service.lead.LeadService;
import io.leadzpay.service.rating.CarrierCatalog;
import io.leadzpay.service.rating.RatingEngine;
import io.leadzpay.service.rating.VehicleParser;
import io.leadzpay.transport.http.ApiRoutes;
import io.leadzpay.transport.http.ConnectionHandler;
import io.leadzpay.transport.http.LeadHandler;
import io.leadzpay.transport.http.RatingHandler;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * LeadzPay marketplace service entry point.
 *
 * Wiring order: config → storage → catalog/rating → lifecycle/ledger → HTTP.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Starting LeadzPay marketplace...");
        log.info("════════════════════════════════════════════════════════");

        MarketplaceConfig config = MarketplaceConfig.fromEnv();
        log.info("Config: {}", config);

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Storage
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        ConnectionRepository connectionRepo;
        LeadRepository leadRepo;

        if (config.storage() == StorageMode.POSTGRES) {
            dataSource = createDataSource(config);
            new SchemaMigration(dataSource).migrate();
            connectionRepo = new PostgresConnectionRepository(dataSource);
            leadRepo = new PostgresLeadRepository(dataSource);
            log.info("✓ PostgreSQL storage ready");
        } else {
            InMemoryConnectionRepository memoryConnections = new InMemoryConnectionRepository();
            connectionRepo = memoryConnections;
            leadRepo = new InMemoryLeadRepository(memoryConnections);
            log.warn("In-memory storage selected: connections and leads are lost on restart");
        }

        // ═══════════════════════════════════════════════════════════════
        // Services
        // ═══════════════════════════════════════════════════════════════
        PrometheusMarketplaceMetrics metrics = new PrometheusMarketplaceMetrics();
        CarrierCatalog catalog = CarrierCatalog.loadDefault();
        RatingEngine ratingEngine = new RatingEngine(catalog, clock);
        ConnectionCoordinator coordinator = new ConnectionCoordinator();

        ConnectionLifecycleService lifecycle = new ConnectionLifecycleService(
            connectionRepo,
            coordinator,
            new TermsValidator(config.minRatePerLead(), config.maxRatePerLead()),
            metrics,
            clock,
            config.enforceExclusivity());

        LeadLedger ledger = new LeadLedger(
            connectionRepo,
            leadRepo,
            coordinator,
            new CapWindows(clock, config.capZone()),
            new VehicleParser(clock),
            metrics);

        LeadService leadService = new LeadService(leadRepo, clock);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(ApiRoutes.build(
                new RatingHandler(catalog, ratingEngine, metrics),
                new ConnectionHandler(lifecycle, ledger),
                new LeadHandler(leadService),
                new PrometheusMetricsHandler(metrics.getRegistry()),
                clock))
            .build();

        server.start();
        log.info("✓ LeadzPay started on http://localhost:{}/ (metrics at /metrics)", config.port());

        HikariDataSource pool = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down LeadzPay...");
            server.stop();
            coordinator.shutdown();
            if (pool != null) {
                pool.close();
            }
            log.info("LeadzPay stopped");
        }, "leadzpay-shutdown"));
    }

    private static HikariDataSource createDataSource(MarketplaceConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("leadzpay-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
