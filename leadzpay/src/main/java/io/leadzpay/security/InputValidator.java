package io.leadzpay.security;

import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.lead.CustomerContact;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input validator for user-supplied text reaching the marketplace.
 *
 * Features:
 * - Validates customer contact details (email, phone, state code)
 * - Rejects script injection in free text (messages, reasons, customer names)
 * - Sanitizes free text (trim, control characters, length)
 *
 * Usage:
 * <pre>
 * InputValidator validator = new InputValidator();
 * CustomerContact clean = validator.validateCustomer(submission.customer());
 * String message = validator.validateFreeText(request.message(), "message");
 * </pre>
 *
 * Failures throw InvalidRequestException so the transport layer answers 400.
 */
public class InputValidator {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?[0-9 ().-]{7,20}$");
    private static final Pattern STATE_PATTERN = Pattern.compile("^[A-Z]{2}$");

    private static final Pattern XSS_PATTERN =
        Pattern.compile(".*(<script|javascript:|onerror=|onload=|<iframe|<object|<embed).*",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public static final int MAX_STRING_LENGTH = 1000;

    // Column widths of the leads table
    public static final int MAX_NAME_LENGTH = 200;
    public static final int MAX_EMAIL_LENGTH = 200;
    public static final int MAX_CAR_MODEL_LENGTH = 200;
    private static final int MIN_PHONE_DIGITS = 7;

    public boolean isValidEmail(String email) {
        return email != null && email.trim().length() <= MAX_EMAIL_LENGTH && EMAIL_PATTERN.matcher(email.trim()).matches();
    }

    /**
     * Digits with optional +, spaces, dots, dashes and parentheses; at least 7 digits.
     */
    public boolean isValidPhone(String phone) {
        if (phone == null || !PHONE_PATTERN.matcher(phone.trim()).matches()) {
            return false;
        }
        return phone.chars().filter(Character::isDigit).count() >= MIN_PHONE_DIGITS;
    }

    /**
     * Two-letter US state code, case-insensitive.
     */
    public boolean isValidStateCode(String state) {
        return state != null && STATE_PATTERN.matcher(state.trim().toUpperCase(Locale.ROOT)).matches();
    }

    public boolean containsXss(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        return XSS_PATTERN.matcher(input).matches();
    }

    /**
     * Sanitize string by removing dangerous characters.
     *
     * - Trims whitespace
     * - Removes control characters (except newline and tab)
     * - Limits length to MAX_STRING_LENGTH
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }

        String result = input.trim().replaceAll("[\\p{Cntrl}&&[^\n\t]]", "");

        if (result.length() > MAX_STRING_LENGTH) {
            result = result.substring(0, MAX_STRING_LENGTH);
        }
        return result;
    }

    /**
     * Validate and sanitize optional free text. Blank input comes back as null.
     *
     * @throws InvalidRequestException if the text is too long or carries markup
     */
    public String validateFreeText(String input, String fieldName) {
        return validateFreeText(input, fieldName, MAX_STRING_LENGTH);
    }

    public String validateFreeText(String input, String fieldName, int maxLength) {
        if (input == null || input.isBlank()) {
            return null;
        }
        if (input.trim().length() > maxLength) {
            throw new InvalidRequestException(fieldName + " exceeds maximum length (" + maxLength + ")");
        }
        if (containsXss(input)) {
            throw new InvalidRequestException(fieldName + " contains markup that is not allowed");
        }
        return sanitize(input);
    }

    /**
     * Validate the customer captured with a lead and return a cleaned copy.
     *
     * Rules:
     * - Name required, at most MAX_NAME_LENGTH characters
     * - At least one of email or phone, each well-formed when present
     * - State, when present, is a two-letter code (stored uppercase)
     *
     * @throws InvalidRequestException describing the first violated rule
     */
    public CustomerContact validateCustomer(CustomerContact customer) {
        if (customer == null) {
            throw new InvalidRequestException("Customer details are required");
        }

        String name = validateFreeText(customer.name(), "Customer name", MAX_NAME_LENGTH);
        if (name == null) {
            throw new InvalidRequestException("Customer name is required");
        }

        String email = blankToNull(customer.email());
        String phone = blankToNull(customer.phone());
        if (email == null && phone == null) {
            throw new InvalidRequestException("Customer email or phone is required");
        }
        if (email != null && !isValidEmail(email)) {
            throw new InvalidRequestException("Invalid customer email: " + email);
        }
        if (phone != null && !isValidPhone(phone)) {
            throw new InvalidRequestException("Invalid customer phone: " + phone);
        }

        String state = blankToNull(customer.state());
        if (state != null) {
            if (!isValidStateCode(state)) {
                throw new InvalidRequestException("Invalid customer state: " + state);
            }
            state = state.toUpperCase(Locale.ROOT);
        }

        return new CustomerContact(name, email, phone, state);
    }

    /**
     * Vehicle description such as "2019 Ford Focus". Optional; blank comes back as null.
     */
    public String validateCarModel(String carModel) {
        return validateFreeText(carModel, "carModel", MAX_CAR_MODEL_LENGTH);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
