package io.leadzpay.config;

import io.leadzpay.util.Env;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Process configuration, read once at startup.
 */
public record MarketplaceConfig(
    int port,

    // Persistence
    StorageMode storage,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,

    // Marketplace rules
    ZoneId capZone,                 // Reference zone for weekly/monthly cap windows
    boolean enforceExclusivity,     // Block accept when exclusivity would be violated
    BigDecimal minRatePerLead,
    BigDecimal maxRatePerLead
) {
    public static final int DEFAULT_PORT = 9090;
    public static final int DEFAULT_POOL_SIZE = 10;
    public static final BigDecimal DEFAULT_MIN_RATE = new BigDecimal("5");
    public static final BigDecimal DEFAULT_MAX_RATE = new BigDecimal("500");

    public static MarketplaceConfig defaults() {
        return new MarketplaceConfig(
            DEFAULT_PORT,
            StorageMode.POSTGRES,
            "jdbc:postgresql://localhost:5432/leadzpay",
            "leadzpay",
            "leadzpay",
            DEFAULT_POOL_SIZE,
            ZoneId.of("UTC"),
            false,
            DEFAULT_MIN_RATE,
            DEFAULT_MAX_RATE
        );
    }

    /**
     * Read configuration from the environment (falling back to system properties).
     *
     * @throws IllegalStateException if any value is malformed or out of range
     */
    public static MarketplaceConfig fromEnv() {
        MarketplaceConfig d = defaults();
        MarketplaceConfig config = new MarketplaceConfig(
            Env.getInt("PORT", d.port()),
            StorageMode.fromWire(Env.get("LEADZPAY_STORAGE", "postgres")),
            Env.get("DB_URL", d.dbUrl()),
            Env.get("DB_USER", d.dbUser()),
            Env.get("DB_PASS", d.dbPass()),
            Env.getInt("DB_POOL_SIZE", d.dbPoolSize()),
            parseZone(Env.get("LEADZPAY_CAP_ZONE", "UTC")),
            Env.getBool("LEADZPAY_ENFORCE_EXCLUSIVITY", d.enforceExclusivity()),
            Env.getDecimal("LEADZPAY_MIN_RATE", d.minRatePerLead()),
            Env.getDecimal("LEADZPAY_MAX_RATE", d.maxRatePerLead())
        );
        config.validate();
        return config;
    }

    public boolean isValid() {
        return port > 0 && port <= 65535
            && dbPoolSize > 0
            && storage != null
            && capZone != null
            && minRatePerLead != null && maxRatePerLead != null
            && minRatePerLead.signum() > 0
            && minRatePerLead.compareTo(maxRatePerLead) <= 0
            && (storage == StorageMode.MEMORY || (dbUrl != null && !dbUrl.isBlank()));
    }

    /**
     * @throws IllegalStateException if the configuration is unusable
     */
    public void validate() {
        if (!isValid()) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + this);
        }
    }

    public MarketplaceConfig withStorage(StorageMode mode) {
        return new MarketplaceConfig(port, mode, dbUrl, dbUser, dbPass, dbPoolSize,
            capZone, enforceExclusivity, minRatePerLead, maxRatePerLead);
    }

    @Override
    public String toString() {
        // Never log dbPass
        return "MarketplaceConfig[port=" + port + ", storage=" + storage + ", dbUrl=" + dbUrl
            + ", dbUser=" + dbUser + ", dbPoolSize=" + dbPoolSize + ", capZone=" + capZone
            + ", enforceExclusivity=" + enforceExclusivity
            + ", rateBounds=[" + minRatePerLead + ", " + maxRatePerLead + "]]";
    }

    private static ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: LEADZPAY_CAP_ZONE is not a valid zone: " + value, e);
        }
    }
}
