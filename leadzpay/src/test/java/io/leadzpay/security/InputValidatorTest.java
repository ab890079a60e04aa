package io.leadzpay.security;

import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.lead.CustomerContact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputValidator contact and free-text validation.
 */
@DisplayName("Input Validator Tests")
public class InputValidatorTest {

    private InputValidator validator;

    @BeforeEach
    public void setUp() {
        validator = new InputValidator();
    }

    @Test
    @DisplayName("Well-formed emails pass")
    public void testEmails() {
        assertTrue(validator.isValidEmail("jane@example.com"));
        assertTrue(validator.isValidEmail("jane.doe+leads@mail.example.co"));
        assertFalse(validator.isValidEmail("jane@"));
        assertFalse(validator.isValidEmail("jane example.com"));
        assertFalse(validator.isValidEmail(null));
    }

    @Test
    @DisplayName("Phones need seven digits")
    public void testPhones() {
        assertTrue(validator.isValidPhone("555-0100"));
        assertTrue(validator.isValidPhone("+1 (215) 555-0100"));
        assertFalse(validator.isValidPhone("555-01"));
        assertFalse(validator.isValidPhone("call me"));
    }

    @Test
    @DisplayName("State codes are two letters")
    public void testStateCodes() {
        assertTrue(validator.isValidStateCode("PA"));
        assertTrue(validator.isValidStateCode("pa"));
        assertFalse(validator.isValidStateCode("Penn"));
        assertFalse(validator.isValidStateCode("P1"));
    }

    @Test
    @DisplayName("Script markup is rejected in free text")
    public void testFreeText() {
        assertEquals("Interested in auto leads", validator.validateFreeText("  Interested in auto leads ", "message"));
        assertNull(validator.validateFreeText("   ", "message"));
        assertThrows(InvalidRequestException.class,
            () -> validator.validateFreeText("<script>alert(1)</script>", "message"));
        assertThrows(InvalidRequestException.class,
            () -> validator.validateFreeText("x".repeat(InputValidator.MAX_STRING_LENGTH + 1), "message"));
    }

    @Test
    @DisplayName("Sanitize strips control characters")
    public void testSanitize() {
        assertEquals("Jane Doe", validator.sanitize(" Jane\u0000 Doe "));
        assertEquals("line one\nline two", validator.sanitize("line one\nline two"));
        assertNull(validator.sanitize(null));
    }

    @Test
    @DisplayName("Customer is cleaned and normalized")
    public void testValidCustomer() {
        CustomerContact clean = validator.validateCustomer(
            new CustomerContact("  Jane Doe ", " jane@example.com ", "", "pa"));

        assertEquals("Jane Doe", clean.name());
        assertEquals("jane@example.com", clean.email());
        assertNull(clean.phone());
        assertEquals("PA", clean.state());
    }

    @Test
    @DisplayName("Fields longer than their stored width are rejected")
    public void testStoredWidths() {
        String name = "J".repeat(InputValidator.MAX_NAME_LENGTH);
        assertEquals(name, validator.validateCustomer(new CustomerContact(name, "jane@example.com", null, null)).name());
        assertThrows(InvalidRequestException.class,
            () -> validator.validateCustomer(new CustomerContact(name + "J", "jane@example.com", null, null)));

        String longEmail = "j".repeat(InputValidator.MAX_EMAIL_LENGTH) + "@example.com";
        assertFalse(validator.isValidEmail(longEmail));
        assertThrows(InvalidRequestException.class,
            () -> validator.validateCustomer(new CustomerContact("Jane Doe", longEmail, null, null)));

        assertEquals("2019 Ford Focus", validator.validateCarModel(" 2019 Ford Focus "));
        assertNull(validator.validateCarModel(""));
        assertThrows(InvalidRequestException.class,
            () -> validator.validateCarModel("x".repeat(InputValidator.MAX_CAR_MODEL_LENGTH + 1)));
    }

    @Test
    @DisplayName("Customer without a way to reach them is rejected")
    public void testInvalidCustomers() {
        assertThrows(InvalidRequestException.class, () -> validator.validateCustomer(null));
        assertThrows(InvalidRequestException.class,
            () -> validator.validateCustomer(new CustomerContact("", "jane@example.com", null, null)));
        assertThrows(InvalidRequestException.class,
            () -> validator.validateCustomer(new CustomerContact("Jane Doe", null, null, null)));
        assertThrows(InvalidRequestException.class,
            () -> validator.validateCustomer(new CustomerContact("Jane Doe", "not-an-email", null, null)));
        assertThrows(InvalidRequestException.class,
            () -> validator.validateCustomer(new CustomerContact("Jane Doe", "jane@example.com", null, "Pennsylvania")));
    }
}
