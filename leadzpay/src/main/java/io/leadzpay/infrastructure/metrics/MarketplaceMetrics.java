package io.leadzpay.infrastructure.metrics;

import java.math.BigDecimal;

/**
 * Marketplace metrics interface for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or any other backend.
 *
 * Key metrics:
 * - Quote requests and carriers quoted per request
 * - Connection transitions by action
 * - Accepted leads and accrued payout
 * - Submissions refused by lead caps
 */
public interface MarketplaceMetrics {

    /**
     * Record one rating request.
     *
     * @param carriersQuoted Number of quotes returned
     */
    void recordQuotesComputed(int carriersQuoted);

    /**
     * Record a successful connection transition (including creation as "request" / "invite").
     *
     * @param action Wire name of the action
     */
    void recordTransition(String action);

    /**
     * Record an accepted lead and its fixed payout.
     */
    void recordLeadSubmitted(BigDecimal payout);

    /**
     * Record a submission refused because a cap was reached.
     *
     * @param window weekly | monthly | both
     */
    void recordCapRejection(String window);

    /**
     * Metrics sink that drops everything.
     */
    MarketplaceMetrics NOOP = new MarketplaceMetrics() {
        @Override
        public void recordQuotesComputed(int carriersQuoted) {}

        @Override
        public void recordTransition(String action) {}

        @Override
        public void recordLeadSubmitted(BigDecimal payout) {}

        @Override
        public void recordCapRejection(String window) {}
    };
}
