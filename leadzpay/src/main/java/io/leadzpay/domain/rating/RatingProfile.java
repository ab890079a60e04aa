package io.leadzpay.domain.rating;

/**
 * Driver, vehicle and coverage inputs for one quote request.
 *
 * Callers supply sane defaults for absent numeric input; the rating engine does not guess.
 */
public record RatingProfile(
    // Driver
    int age,
    Gender gender,
    MaritalStatus maritalStatus,
    CreditTier creditTier,
    boolean homeOwner,
    int yearsLicensed,
    DrivingHistory drivingHistory,
    boolean priorInsurance,
    Occupation occupation,
    int annualMileage,

    // Vehicle
    String carModel,
    VehicleOwnership vehicleOwnership,
    PrimaryUse primaryUse,
    GarageType garageType,
    boolean antiTheft,
    boolean safetyFeatures,

    // Coverage
    CoverageType coverageType,
    int deductible,

    String state
) {
    public static final String DEFAULT_STATE = "PA";

    /**
     * Profile used when only a vehicle and state are known.
     */
    public static RatingProfile defaults(String carModel, String state) {
        return new RatingProfile(
            35, Gender.OTHER, MaritalStatus.SINGLE, CreditTier.GOOD, false, 10,
            DrivingHistory.CLEAN, true, Occupation.STANDARD, 12000,
            carModel, VehicleOwnership.OWNED, PrimaryUse.COMMUTE, GarageType.GARAGE, false, true,
            CoverageType.FULL, 500,
            state == null || state.isBlank() ? DEFAULT_STATE : state);
    }

    public RatingProfile withCoverageType(CoverageType type) {
        return new RatingProfile(
            age, gender, maritalStatus, creditTier, homeOwner, yearsLicensed,
            drivingHistory, priorInsurance, occupation, annualMileage,
            carModel, vehicleOwnership, primaryUse, garageType, antiTheft, safetyFeatures,
            type, deductible, state);
    }
}
