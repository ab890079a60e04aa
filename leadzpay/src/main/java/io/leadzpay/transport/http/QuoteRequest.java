package io.leadzpay.transport.http;

import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.rating.CoverageType;
import io.leadzpay.domain.rating.CreditTier;
import io.leadzpay.domain.rating.DrivingHistory;
import io.leadzpay.domain.rating.GarageType;
import io.leadzpay.domain.rating.Gender;
import io.leadzpay.domain.rating.MaritalStatus;
import io.leadzpay.domain.rating.Occupation;
import io.leadzpay.domain.rating.PrimaryUse;
import io.leadzpay.domain.rating.RatingProfile;
import io.leadzpay.domain.rating.VehicleOwnership;

/**
 * POST /api/quotes body. Every field but carModel is optional; absent fields take the
 * default rating profile's value.
 */
public record QuoteRequest(
    Integer age,
    Gender gender,
    MaritalStatus maritalStatus,
    CreditTier creditTier,
    Boolean homeOwner,
    Integer yearsLicensed,
    DrivingHistory drivingHistory,
    Boolean priorInsurance,
    Occupation occupation,
    Integer annualMileage,
    String carModel,
    VehicleOwnership vehicleOwnership,
    PrimaryUse primaryUse,
    GarageType garageType,
    Boolean antiTheft,
    Boolean safetyFeatures,
    CoverageType coverageType,
    Integer deductible,
    String state
) {
    public RatingProfile toProfile() {
        if (carModel == null || carModel.isBlank()) {
            throw new InvalidRequestException("carModel is required");
        }
        if (age != null && (age < 15 || age > 110)) {
            throw new InvalidRequestException("age must be between 15 and 110");
        }

        RatingProfile d = RatingProfile.defaults(carModel, state);
        return new RatingProfile(
            age != null ? age : d.age(),
            gender != null ? gender : d.gender(),
            maritalStatus != null ? maritalStatus : d.maritalStatus(),
            creditTier != null ? creditTier : d.creditTier(),
            homeOwner != null ? homeOwner : d.homeOwner(),
            yearsLicensed != null ? yearsLicensed : d.yearsLicensed(),
            drivingHistory != null ? drivingHistory : d.drivingHistory(),
            priorInsurance != null ? priorInsurance : d.priorInsurance(),
            occupation != null ? occupation : d.occupation(),
            annualMileage != null ? annualMileage : d.annualMileage(),
            carModel,
            vehicleOwnership != null ? vehicleOwnership : d.vehicleOwnership(),
            primaryUse != null ? primaryUse : d.primaryUse(),
            garageType != null ? garageType : d.garageType(),
            antiTheft != null ? antiTheft : d.antiTheft(),
            safetyFeatures != null ? safetyFeatures : d.safetyFeatures(),
            coverageType != null ? coverageType : d.coverageType(),
            deductible != null ? deductible : d.deductible(),
            d.state());
    }
}
