package io.leadzpay.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusMarketplaceMetricsTest {

    private CollectorRegistry registry;
    private PrometheusMarketplaceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusMarketplaceMetrics(registry);
    }

    @Test
    void testTransitionsLabelledByAction() {
        metrics.recordTransition("accept");
        metrics.recordTransition("accept");
        metrics.recordTransition("terminate");

        assertEquals(2.0, registry.getSampleValue("leadzpay_connection_transitions_total",
            new String[]{"action"}, new String[]{"accept"}));
        assertEquals(1.0, registry.getSampleValue("leadzpay_connection_transitions_total",
            new String[]{"action"}, new String[]{"terminate"}));
    }

    @Test
    void testLeadPayoutAccrues() {
        metrics.recordLeadSubmitted(new BigDecimal("40"));
        metrics.recordLeadSubmitted(new BigDecimal("12.50"));

        assertEquals(2.0, registry.getSampleValue("leadzpay_leads_submitted_total"));
        assertEquals(52.5, registry.getSampleValue("leadzpay_lead_payout_total"), 0.0001);
    }

    @Test
    void testCapRejectionsLabelledByWindow() {
        metrics.recordCapRejection("weekly");

        assertEquals(1.0, registry.getSampleValue("leadzpay_lead_cap_rejections_total",
            new String[]{"window"}, new String[]{"weekly"}));
        assertNull(registry.getSampleValue("leadzpay_lead_cap_rejections_total",
            new String[]{"window"}, new String[]{"monthly"}));
    }

    @Test
    void testQuotesComputed() {
        metrics.recordQuotesComputed(9);
        metrics.recordQuotesComputed(10);

        assertEquals(2.0, registry.getSampleValue("leadzpay_quotes_computed_total"));
        assertEquals(2.0, registry.getSampleValue("leadzpay_quote_carriers_count"));
        assertEquals(19.0, registry.getSampleValue("leadzpay_quote_carriers_sum"));
    }
}
