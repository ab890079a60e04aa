package io.leadzpay.service.connection;

import io.leadzpay.domain.connection.ContractTerms;
import io.leadzpay.domain.connection.InvalidTermsException;
import io.leadzpay.domain.connection.LeadCaps;

import java.math.BigDecimal;

/**
 * Validates contract terms before they are stored on a connection.
 *
 * Rate bounds are the fair-market range from configuration ($5 to $500 by default).
 */
public final class TermsValidator {

    private final BigDecimal minRate;
    private final BigDecimal maxRate;

    public TermsValidator(BigDecimal minRate, BigDecimal maxRate) {
        if (minRate.compareTo(maxRate) > 0) {
            throw new IllegalArgumentException("minRate " + minRate + " exceeds maxRate " + maxRate);
        }
        this.minRate = minRate;
        this.maxRate = maxRate;
    }

    /**
     * @return the terms, unchanged, when valid
     * @throws InvalidTermsException describing the first violated rule
     */
    public ContractTerms validate(ContractTerms terms) {
        if (terms == null) {
            throw new InvalidTermsException("Contract terms are required");
        }

        BigDecimal rate = terms.ratePerLead();
        if (rate.compareTo(minRate) < 0 || rate.compareTo(maxRate) > 0) {
            throw new InvalidTermsException(
                "Rate per lead must be between $" + minRate.toPlainString() + " and $" + maxRate.toPlainString()
                    + ", got $" + rate.toPlainString());
        }

        if (terms.minimumPayoutThreshold() != null && terms.minimumPayoutThreshold().signum() < 0) {
            throw new InvalidTermsException("Minimum payout threshold cannot be negative");
        }

        if (terms.terminationNoticeDays() < 0) {
            throw new InvalidTermsException("Termination notice days cannot be negative");
        }

        LeadCaps caps = terms.leadCaps();
        if (caps != null) {
            if (caps.weeklyLimit() != null && caps.weeklyLimit() < 1) {
                throw new InvalidTermsException("Weekly lead limit must be at least 1");
            }
            if (caps.monthlyLimit() != null && caps.monthlyLimit() < 1) {
                throw new InvalidTermsException("Monthly lead limit must be at least 1");
            }
        }

        return terms;
    }
}
