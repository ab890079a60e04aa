package io.leadzpay.service.rating;

import java.util.Locale;
import java.util.Map;

/**
 * Carrier-independent actuarial tables: driver age, vehicle age, vehicle make, deductible.
 *
 * The band boundaries and multipliers are fixed; carriers differ only in their own
 * base rates, discount/surcharge fractions and state multipliers.
 */
public final class RatingTables {

    public static final double DEFAULT_MAKE_FACTOR = 1.00;

    private static final Map<String, Double> MAKE_FACTORS = Map.ofEntries(
        // Luxury / performance
        Map.entry("bmw", 1.35), Map.entry("mercedes", 1.40), Map.entry("audi", 1.30),
        Map.entry("lexus", 1.25), Map.entry("porsche", 1.60), Map.entry("tesla", 1.45),
        Map.entry("jaguar", 1.35), Map.entry("land rover", 1.30), Map.entry("infiniti", 1.25),
        Map.entry("acura", 1.20), Map.entry("corvette", 1.50), Map.entry("mustang", 1.20),
        Map.entry("camaro", 1.25), Map.entry("challenger", 1.20), Map.entry("charger", 1.18),
        // Mainstream / economy
        Map.entry("toyota", 0.90), Map.entry("honda", 0.90), Map.entry("ford", 1.00),
        Map.entry("chevrolet", 1.00), Map.entry("hyundai", 0.95), Map.entry("kia", 0.95),
        Map.entry("nissan", 0.95), Map.entry("mazda", 0.95), Map.entry("subaru", 1.00),
        Map.entry("volkswagen", 1.05), Map.entry("jeep", 1.05), Map.entry("ram", 1.05),
        Map.entry("gmc", 1.05), Map.entry("buick", 0.95), Map.entry("chrysler", 1.00)
    );

    // Extra discount for raising the deductible; $250 is the baseline
    private static final Map<Integer, Double> DEDUCTIBLE_DISCOUNTS = Map.of(
        250, 0.00,
        500, 0.08,
        1000, 0.15,
        2000, 0.22
    );

    /**
     * Driver age multiplier (step function).
     */
    public static double ageFactor(int age) {
        if (age < 18) return 3.00;
        if (age < 20) return 2.50;
        if (age < 22) return 2.00;
        if (age < 25) return 1.60;
        if (age < 30) return 1.15;
        if (age < 40) return 1.00;
        if (age < 50) return 0.95;
        if (age < 60) return 0.92;
        if (age < 65) return 0.95;
        if (age < 70) return 1.00;
        if (age < 75) return 1.10;
        return 1.25;
    }

    /**
     * Vehicle year multiplier. Newer vehicles cost more to repair or replace.
     *
     * @param vehicleYear Model year
     * @param currentYear Calendar year the quote is priced in
     */
    public static double vehicleYearFactor(int vehicleYear, int currentYear) {
        int vehicleAge = currentYear - vehicleYear;
        if (vehicleAge <= 0) return 1.50;
        if (vehicleAge <= 1) return 1.40;
        if (vehicleAge <= 2) return 1.30;
        if (vehicleAge <= 3) return 1.20;
        if (vehicleAge <= 5) return 1.10;
        if (vehicleAge <= 8) return 1.00;
        if (vehicleAge <= 10) return 0.92;
        if (vehicleAge <= 15) return 0.85;
        return 0.75;
    }

    /**
     * Make multiplier, case-insensitive. Unknown makes rate at 1.00.
     */
    public static double makeFactor(String make) {
        if (make == null) {
            return DEFAULT_MAKE_FACTOR;
        }
        return MAKE_FACTORS.getOrDefault(make.trim().toLowerCase(Locale.ROOT), DEFAULT_MAKE_FACTOR);
    }

    /**
     * Deductible discount fraction; unlisted deductibles earn nothing.
     */
    public static double deductibleDiscount(int deductible) {
        return DEDUCTIBLE_DISCOUNTS.getOrDefault(deductible, 0.0);
    }

    private RatingTables() {}
}
