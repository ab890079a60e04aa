package io.leadzpay.service.rating;

import io.leadzpay.domain.rating.CarrierConfig;
import io.leadzpay.domain.rating.CarrierEligibility;
import io.leadzpay.domain.rating.Occupation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CarrierCatalogTest {

    @Test
    void testDefaultCatalogLoads() {
        CarrierCatalog catalog = CarrierCatalog.loadDefault();

        assertEquals(10, catalog.size());
        assertEquals("state_farm", catalog.all().get(0).id());
        assertTrue(catalog.findById("usaa").isPresent());
        assertEquals(CarrierEligibility.MILITARY_ONLY, catalog.findById("usaa").get().eligibility());
    }

    @Test
    void testMilitaryOnlyCarrierExcludedForCivilians() {
        CarrierCatalog catalog = CarrierCatalog.loadDefault();

        List<CarrierConfig> civilian = catalog.listEligibleCarriers(Occupation.STANDARD);
        List<CarrierConfig> military = catalog.listEligibleCarriers(Occupation.MILITARY);

        assertEquals(9, civilian.size());
        assertTrue(civilian.stream().noneMatch(c -> c.id().equals("usaa")));
        assertEquals(10, military.size());
        assertTrue(military.stream().anyMatch(c -> c.id().equals("usaa")));
    }

    @Test
    void testDirectOnlyCarrierIsExclusiveButQuotesEveryone() {
        CarrierCatalog catalog = CarrierCatalog.loadDefault();
        CarrierConfig geico = catalog.findById("geico").orElseThrow();

        assertTrue(geico.isExclusive());
        assertTrue(catalog.listEligibleCarriers(Occupation.STANDARD).contains(geico));
    }

    @Test
    void testUnavailableCarrierSkipped() {
        CarrierCatalog catalog = CarrierCatalog.of(List.of(
            RatingFixtures.carrier("open_co", 1200, CarrierEligibility.OPEN, true),
            RatingFixtures.carrier("paused_co", 1000, CarrierEligibility.OPEN, false)));

        assertEquals(1, catalog.listAvailable().size());
        assertEquals(1, catalog.listEligibleCarriers(Occupation.STANDARD).size());
        assertEquals(2, catalog.all().size());
    }

    @Test
    void testDuplicateIdsRejected() {
        CarrierConfig carrier = RatingFixtures.carrier("dup", 1200, CarrierEligibility.OPEN, true);

        assertThrows(IllegalArgumentException.class, () -> CarrierCatalog.of(List.of(carrier, carrier)));
    }

    @Test
    void testMissingResourceFailsFast() {
        assertThrows(IllegalStateException.class, () -> CarrierCatalog.load("no-such-carriers.json"));
    }

    @Test
    void testFindByIdUnknown() {
        CarrierCatalog catalog = CarrierCatalog.loadDefault();

        assertTrue(catalog.findById("acme").isEmpty());
        assertTrue(catalog.findById(null).isEmpty());
    }

    @Test
    void testStateMultiplierDefaultsToOne() {
        CarrierConfig stateFarm = CarrierCatalog.loadDefault().findById("state_farm").orElseThrow();

        assertEquals(1.8, stateFarm.stateMultiplier("MI"));
        assertEquals(1.8, stateFarm.stateMultiplier("mi"));
        assertEquals(1.0, stateFarm.stateMultiplier("VT"));
        assertEquals(1.0, stateFarm.stateMultiplier(null));
    }
}
