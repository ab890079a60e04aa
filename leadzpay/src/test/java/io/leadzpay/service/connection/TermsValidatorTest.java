package io.leadzpay.service.connection;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.connection.ContractTerms;
import io.leadzpay.domain.connection.InvalidTermsException;
import io.leadzpay.domain.connection.LeadCaps;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TermsValidatorTest {

    private final TermsValidator validator = new TermsValidator(new BigDecimal("5"), new BigDecimal("500"));

    @Test
    void testRateBoundsInclusive() {
        assertNotNull(validator.validate(ContractTerms.ofRate(new BigDecimal("5"))));
        assertNotNull(validator.validate(ContractTerms.ofRate(new BigDecimal("500"))));
        assertNotNull(validator.validate(ContractTerms.ofRate(new BigDecimal("49.99"))));
    }

    @Test
    void testRateBelowMinimum() {
        InvalidTermsException e = assertThrows(InvalidTermsException.class,
            () -> validator.validate(ContractTerms.ofRate(new BigDecimal("4.99"))));

        assertEquals(ErrorCode.INVALID_TERMS, e.getCode());
        assertEquals("Rate per lead must be between $5 and $500, got $4.99", e.getMessage());
    }

    @Test
    void testRateAboveMaximum() {
        assertThrows(InvalidTermsException.class,
            () -> validator.validate(ContractTerms.ofRate(new BigDecimal("500.01"))));
    }

    @Test
    void testMissingTerms() {
        assertThrows(InvalidTermsException.class, () -> validator.validate(null));
    }

    @Test
    void testDefaultsApplied() {
        ContractTerms terms = validator.validate(ContractTerms.ofRate(null));

        assertEquals(ContractTerms.DEFAULT_RATE, terms.ratePerLead());
        assertEquals(7, terms.terminationNoticeDays());
        assertEquals("1.0.0", terms.agreementVersion());
        assertTrue(terms.leadTypes().contains("auto"));
    }

    @Test
    void testNonPositiveCapLimitsRejected() {
        ContractTerms zeroWeekly = ContractTerms.ofRate(new BigDecimal("50"))
            .withLeadCaps(new LeadCaps(0, null, true));
        ContractTerms negativeMonthly = ContractTerms.ofRate(new BigDecimal("50"))
            .withLeadCaps(new LeadCaps(null, -1, false));

        assertThrows(InvalidTermsException.class, () -> validator.validate(zeroWeekly));
        assertThrows(InvalidTermsException.class, () -> validator.validate(negativeMonthly));
    }

    @Test
    void testNegativeNoticeRejected() {
        ContractTerms terms = new ContractTerms(new BigDecimal("50"), null, null, null, false, null,
            -1, null, null, false, null);

        assertThrows(InvalidTermsException.class, () -> validator.validate(terms));
    }

    @Test
    void testNegativePayoutThresholdRejected() {
        ContractTerms terms = new ContractTerms(new BigDecimal("50"), null, new BigDecimal("-10"), null, false, null,
            null, null, null, false, null);

        assertThrows(InvalidTermsException.class, () -> validator.validate(terms));
    }

    @Test
    void testInvertedBoundsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new TermsValidator(new BigDecimal("100"), new BigDecimal("10")));
    }
}
