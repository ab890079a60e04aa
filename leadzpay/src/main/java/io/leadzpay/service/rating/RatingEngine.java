package io.leadzpay.service.rating;

import io.leadzpay.domain.rating.CarrierConfig;
import io.leadzpay.domain.rating.CoverageType;
import io.leadzpay.domain.rating.CreditTier;
import io.leadzpay.domain.rating.DiscountFactors;
import io.leadzpay.domain.rating.DrivingHistory;
import io.leadzpay.domain.rating.MaritalStatus;
import io.leadzpay.domain.rating.Occupation;
import io.leadzpay.domain.rating.QuoteResult;
import io.leadzpay.domain.rating.RatingProfile;
import io.leadzpay.domain.rating.SurchargeFactors;
import io.leadzpay.domain.rating.VehicleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Multi-carrier auto quote rating.
 *
 * PRICING MODEL (per eligible carrier):
 * - raw = baseRate[coverage] x ageFactor x vehicleFactor x stateFactor
 * - discounts are additive and capped at 50% of raw
 * - surcharges are additive and uncapped
 * - annual = round(max(raw - discount + surcharge, 300))
 *
 * Deterministic for a given profile, catalog and calendar year. Holds no mutable state.
 */
public final class RatingEngine {
    private static final Logger log = LoggerFactory.getLogger(RatingEngine.class);

    public static final double MAX_DISCOUNT = 0.50;
    public static final long MIN_ANNUAL_PREMIUM = 300;
    public static final String DEFAULT_PREVIEW_CARRIER = "state_farm";

    private final CarrierCatalog catalog;
    private final Clock clock;

    public RatingEngine(CarrierCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
    }

    /**
     * Price the profile with every eligible carrier.
     *
     * @return Quotes sorted by monthly premium, ties in catalog order
     */
    public List<QuoteResult> computeQuotes(RatingProfile profile) {
        int currentYear = Year.now(clock).getValue();
        VehicleDescriptor vehicle = VehicleParser.parse(profile.carModel(), currentYear);

        List<QuoteResult> results = new ArrayList<>();
        for (CarrierConfig carrier : catalog.listEligibleCarriers(profile.occupation())) {
            results.add(price(carrier, profile, vehicle, currentYear));
        }
        results.sort(Comparator.comparingLong(QuoteResult::monthlyPremium));
        return results;
    }

    /**
     * Price the default profile for each coverage tier with one carrier.
     *
     * @param carrierId Carrier to keep; null means {@value #DEFAULT_PREVIEW_CARRIER}
     * @return One quote per tier in tier order; empty when the carrier is not quoted
     */
    public List<QuoteResult> quoteAllCoverages(String carModel, String state, String carrierId) {
        String wanted = carrierId == null || carrierId.isBlank() ? DEFAULT_PREVIEW_CARRIER : carrierId;
        RatingProfile base = RatingProfile.defaults(carModel, state);

        List<QuoteResult> results = new ArrayList<>();
        for (CoverageType type : CoverageType.values()) {
            computeQuotes(base.withCoverageType(type)).stream()
                .filter(q -> q.carrierId().equals(wanted))
                .findFirst()
                .ifPresent(results::add);
        }
        return results;
    }

    private QuoteResult price(CarrierConfig carrier, RatingProfile p, VehicleDescriptor vehicle, int currentYear) {
        double basePremium = carrier.baseRates().forCoverage(p.coverageType());
        double ageFactor = RatingTables.ageFactor(p.age());
        double vehicleFactor = RatingTables.vehicleYearFactor(vehicle.year(), currentYear)
            * RatingTables.makeFactor(vehicle.make());
        double stateFactor = carrier.stateMultiplier(p.state());

        DiscountFactors d = carrier.discounts();
        List<String> discountsApplied = new ArrayList<>();
        double totalDiscount = 0;

        if (p.homeOwner()) {
            totalDiscount += d.homeOwner();
            discountsApplied.add(discountLabel("Homeowner", d.homeOwner()));
        }
        if (p.maritalStatus() == MaritalStatus.MARRIED) {
            totalDiscount += d.married();
            discountsApplied.add(discountLabel("Married", d.married()));
        }
        if (p.drivingHistory() == DrivingHistory.CLEAN && p.yearsLicensed() >= 3) {
            totalDiscount += d.goodDriver();
            discountsApplied.add(discountLabel("Good Driver", d.goodDriver()));
        }
        if (p.creditTier() == CreditTier.EXCELLENT) {
            totalDiscount += d.goodCredit();
            discountsApplied.add(discountLabel("Excellent Credit", d.goodCredit()));
        } else if (p.creditTier() == CreditTier.GOOD) {
            totalDiscount += d.goodCredit() * 0.5;
            discountsApplied.add(discountLabel("Good Credit", d.goodCredit() * 0.5));
        }
        if (p.annualMileage() < 7500) {
            totalDiscount += d.lowMileage();
            discountsApplied.add(discountLabel("Low Mileage", d.lowMileage()));
        }
        if (p.antiTheft()) {
            totalDiscount += d.antiTheft();
            discountsApplied.add(discountLabel("Anti-Theft Device", d.antiTheft()));
        }
        if (p.safetyFeatures()) {
            totalDiscount += d.safety();
            discountsApplied.add(discountLabel("Safety Features", d.safety()));
        }
        if (p.occupation() == Occupation.MILITARY) {
            totalDiscount += d.military();
            discountsApplied.add(discountLabel("Military", d.military()));
        }

        SurchargeFactors s = carrier.surcharges();
        List<String> surchargesApplied = new ArrayList<>();
        double totalSurcharge = 0;

        if (p.age() < 25) {
            totalSurcharge += s.youngDriver();
            surchargesApplied.add(surchargeLabel("Young Driver", s.youngDriver()));
        }
        if (p.age() > 70) {
            totalSurcharge += s.seniorDriver();
            surchargesApplied.add(surchargeLabel("Senior Driver", s.seniorDriver()));
        }
        if (p.creditTier() == CreditTier.POOR) {
            totalSurcharge += s.poorCredit();
            surchargesApplied.add(surchargeLabel("Credit Score", s.poorCredit()));
        } else if (p.creditTier() == CreditTier.FAIR) {
            totalSurcharge += s.poorCredit() * 0.5;
            surchargesApplied.add(surchargeLabel("Credit Score", s.poorCredit() * 0.5));
        }
        if (!p.priorInsurance()) {
            totalSurcharge += s.noHistory();
            surchargesApplied.add(surchargeLabel("No Prior Insurance", s.noHistory()));
        }
        if (p.yearsLicensed() < 3) {
            totalSurcharge += s.newDriver();
            surchargesApplied.add(surchargeLabel("New Driver", s.newDriver()));
        }
        if (p.drivingHistory() != null) {
            switch (p.drivingHistory()) {
                case MINOR_VIOLATIONS -> {
                    totalSurcharge += s.minorViolation();
                    surchargesApplied.add(surchargeLabel("Violation", s.minorViolation()));
                }
                case MAJOR_VIOLATIONS -> {
                    totalSurcharge += s.majorViolation();
                    surchargesApplied.add(surchargeLabel("Major Violation", s.majorViolation()));
                }
                case ACCIDENTS -> {
                    totalSurcharge += s.accident();
                    surchargesApplied.add(surchargeLabel("At-Fault Accident", s.accident()));
                }
                case DUI -> {
                    totalSurcharge += s.dui();
                    surchargesApplied.add(surchargeLabel("DUI", s.dui()));
                }
                default -> { }
            }
        }
        if (p.annualMileage() > 15000) {
            totalSurcharge += s.highMileage();
            surchargesApplied.add(surchargeLabel("High Mileage", s.highMileage()));
        }

        double deductibleDiscount = RatingTables.deductibleDiscount(p.deductible());
        if (deductibleDiscount > 0) {
            totalDiscount += deductibleDiscount;
            discountsApplied.add("$" + p.deductible() + " Deductible (-" + Math.round(deductibleDiscount * 100) + "%)");
        }

        double appliedDiscount = Math.min(totalDiscount, MAX_DISCOUNT);
        double raw = basePremium * ageFactor * vehicleFactor * stateFactor;
        double discountAmount = raw * appliedDiscount;
        double surchargeAmount = raw * totalSurcharge;
        long annualPremium = Math.round(Math.max(raw - discountAmount + surchargeAmount, MIN_ANNUAL_PREMIUM));

        log.debug("Priced {}: raw={} discount={} surcharge={} annual={}",
            carrier.id(), raw, appliedDiscount, totalSurcharge, annualPremium);

        return new QuoteResult(
            carrier.id(),
            carrier.name(),
            carrier.color(),
            carrier.isExclusive(),
            carrier.avgRating(),
            Math.round(annualPremium / 12.0),
            annualPremium,
            Math.round(annualPremium / 2.0),
            p.coverageType().getLabel(),
            p.deductible(),
            discountsApplied,
            Math.round(appliedDiscount * 100),
            surchargesApplied,
            Math.round(totalSurcharge * 100),
            new QuoteResult.Breakdown(
                basePremium,
                round2(ageFactor),
                round2(vehicleFactor),
                round2(stateFactor),
                Math.round(discountAmount),
                Math.round(surchargeAmount)
            )
        );
    }

    private static String discountLabel(String name, double fraction) {
        return name + " (-" + Math.round(fraction * 100) + "%)";
    }

    private static String surchargeLabel(String name, double fraction) {
        return name + " (+" + Math.round(fraction * 100) + "%)";
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
