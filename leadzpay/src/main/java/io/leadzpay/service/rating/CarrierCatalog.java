package io.leadzpay.service.rating;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leadzpay.domain.rating.CarrierConfig;
import io.leadzpay.domain.rating.Occupation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of carrier rating configurations.
 *
 * Loaded once at startup and shared; list order is the catalog order and is preserved
 * by every query.
 */
public final class CarrierCatalog {
    private static final Logger log = LoggerFactory.getLogger(CarrierCatalog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "carriers.json";

    private final List<CarrierConfig> carriers;
    private final Map<String, CarrierConfig> byId;

    private CarrierCatalog(List<CarrierConfig> carriers) {
        this.carriers = List.copyOf(carriers);
        Map<String, CarrierConfig> index = new LinkedHashMap<>();
        for (CarrierConfig carrier : this.carriers) {
            if (index.putIfAbsent(carrier.id(), carrier) != null) {
                throw new IllegalArgumentException("Duplicate carrier id: " + carrier.id());
            }
        }
        this.byId = Map.copyOf(index);
    }

    public static CarrierCatalog of(List<CarrierConfig> carriers) {
        return new CarrierCatalog(carriers);
    }

    /**
     * Load the bundled carrier tables from the classpath.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static CarrierCatalog loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    static CarrierCatalog load(String resource) {
        try (InputStream in = CarrierCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Carrier catalog resource not found: " + resource);
            }
            List<CarrierConfig> carriers = MAPPER.readValue(in, new TypeReference<List<CarrierConfig>>() {});
            CarrierCatalog catalog = new CarrierCatalog(carriers);
            log.info("✅ Loaded {} carriers from {}", catalog.size(), resource);
            return catalog;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load carrier catalog from " + resource, e);
        }
    }

    /**
     * Carriers that may quote a driver with the given occupation.
     * Unavailable carriers are skipped; military-only carriers require a military occupation.
     */
    public List<CarrierConfig> listEligibleCarriers(Occupation occupation) {
        return carriers.stream()
            .filter(CarrierConfig::available)
            .filter(c -> c.eligibility().admits(occupation))
            .toList();
    }

    public List<CarrierConfig> listAvailable() {
        return carriers.stream().filter(CarrierConfig::available).toList();
    }

    public List<CarrierConfig> all() {
        return carriers;
    }

    public Optional<CarrierConfig> findById(String carrierId) {
        return carrierId == null ? Optional.empty() : Optional.ofNullable(byId.get(carrierId));
    }

    public int size() {
        return carriers.size();
    }
}
