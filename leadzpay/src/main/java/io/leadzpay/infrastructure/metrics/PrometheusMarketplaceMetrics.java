package io.leadzpay.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Prometheus implementation of MarketplaceMetrics.
 *
 * Key Metrics:
 * - leadzpay_quotes_computed_total - Rating requests served
 * - leadzpay_quote_carriers - Carriers quoted per request
 * - leadzpay_connection_transitions_total{action} - Lifecycle transitions
 * - leadzpay_leads_submitted_total - Accepted leads
 * - leadzpay_lead_payout_total - Accrued payout in dollars
 * - leadzpay_lead_cap_rejections_total{window} - Submissions refused by caps
 */
public class PrometheusMarketplaceMetrics implements MarketplaceMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMarketplaceMetrics.class);

    private final CollectorRegistry registry;

    private final Counter quotesComputed;
    private final Histogram quoteCarriers;
    private final Counter transitions;
    private final Counter leadsSubmitted;
    private final Counter leadPayout;
    private final Counter capRejections;

    public PrometheusMarketplaceMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMarketplaceMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.quotesComputed = Counter.build()
            .name("leadzpay_quotes_computed_total")
            .help("Total number of quote rating requests")
            .register(registry);

        this.quoteCarriers = Histogram.build()
            .name("leadzpay_quote_carriers")
            .help("Number of carriers quoted per rating request")
            .buckets(0, 1, 2, 4, 6, 8, 10, 12)
            .register(registry);

        this.transitions = Counter.build()
            .name("leadzpay_connection_transitions_total")
            .help("Total number of connection lifecycle transitions")
            .labelNames("action")
            .register(registry);

        this.leadsSubmitted = Counter.build()
            .name("leadzpay_leads_submitted_total")
            .help("Total number of accepted lead submissions")
            .register(registry);

        this.leadPayout = Counter.build()
            .name("leadzpay_lead_payout_total")
            .help("Total payout accrued by accepted leads, in dollars")
            .register(registry);

        this.capRejections = Counter.build()
            .name("leadzpay_lead_cap_rejections_total")
            .help("Total number of lead submissions refused by caps")
            .labelNames("window")
            .register(registry);

        log.info("[PrometheusMarketplaceMetrics] Initialized");
    }

    @Override
    public void recordQuotesComputed(int carriersQuoted) {
        quotesComputed.inc();
        quoteCarriers.observe(carriersQuoted);
    }

    @Override
    public void recordTransition(String action) {
        transitions.labels(action).inc();
    }

    @Override
    public void recordLeadSubmitted(BigDecimal payout) {
        leadsSubmitted.inc();
        leadPayout.inc(payout.doubleValue());
    }

    @Override
    public void recordCapRejection(String window) {
        capRejections.labels(window).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
