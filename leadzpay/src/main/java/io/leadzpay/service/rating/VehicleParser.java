package io.leadzpay.service.rating;

import io.leadzpay.domain.rating.VehicleDescriptor;

import java.time.Clock;
import java.time.Year;
import java.util.Arrays;

/**
 * Parses free-text vehicle descriptions such as "2021 Honda Civic EX".
 *
 * A leading 4-digit token in [1990, currentYear + 1] is the model year, the next token the
 * make and the rest the model. Without a year token the first token is the make and the
 * year defaults to the current year.
 */
public final class VehicleParser {

    public static final int MIN_MODEL_YEAR = 1990;

    private final Clock clock;

    public VehicleParser(Clock clock) {
        this.clock = clock;
    }

    public VehicleDescriptor parse(String description) {
        return parse(description, Year.now(clock).getValue());
    }

    public static VehicleDescriptor parse(String description, int currentYear) {
        if (description == null || description.isBlank()) {
            return new VehicleDescriptor(currentYear, "", "");
        }

        String[] parts = description.trim().split("\\s+");
        Integer year = parseYear(parts[0], currentYear);

        if (year != null) {
            String make = parts.length > 1 ? parts[1] : "";
            return new VehicleDescriptor(year, make, join(parts, 2));
        }
        return new VehicleDescriptor(currentYear, parts[0], join(parts, 1));
    }

    private static Integer parseYear(String token, int currentYear) {
        if (token.length() != 4 || !token.chars().allMatch(Character::isDigit)) {
            return null;
        }
        int year = Integer.parseInt(token);
        return year >= MIN_MODEL_YEAR && year <= currentYear + 1 ? year : null;
    }

    private static String join(String[] parts, int from) {
        return from >= parts.length ? "" : String.join(" ", Arrays.copyOfRange(parts, from, parts.length));
    }
}
