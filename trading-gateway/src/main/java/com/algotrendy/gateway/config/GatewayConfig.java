package com.algotrendy.gateway.config;

import com.algotrendy.gateway.exception.InvalidConfigurationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Gateway configuration loaded from config.properties.
 *
 * Lookup order:
 * - config.properties in the working directory (production)
 * - config.properties on the classpath (tests)
 * - built-in defaults
 *
 * Credentials are read from environment variables first and fall back to the file.
 * Instances are immutable and passed to components at construction; there is no
 * shared global instance.
 */
public final class GatewayConfig {
    private static final Logger logger = LoggerFactory.getLogger(GatewayConfig.class);
    private static final String CONFIG_FILE = "config.properties";

    private final Properties properties;

    // Market data orchestration
    @Positive(message = "Fetch interval must be positive")
    private final long fetchIntervalSeconds;

    @PositiveOrZero(message = "Startup delay cannot be negative")
    private final long startupDelaySeconds;

    @NotBlank(message = "Market data interval is required")
    private final String marketDataInterval;

    @Positive(message = "Market data limit must be positive")
    private final int marketDataLimit;

    @NotEmpty(message = "At least one market data channel is required")
    private final List<String> channels;

    // Orders
    @NotBlank
    @Pattern(regexp = "^[A-Za-z0-9]+$", message = "Client order id prefix must be alphanumeric")
    private final String clientOrderIdPrefix;

    // Bars
    @Positive(message = "Tick size must be positive")
    private final int tickBarSize;

    @Positive(message = "Range threshold must be positive")
    private final BigDecimal rangeBarThreshold;

    @Positive(message = "Renko brick size must be positive")
    private final BigDecimal renkoBrickSize;

    @Positive(message = "Renko ATR period must be positive")
    private final int renkoAtrPeriod;

    @Positive(message = "Aggregator shard count must be positive")
    private final int aggregatorShards;

    private final boolean binanceTestnet;

    // Persistence
    @NotBlank(message = "Database path is required")
    private final String databasePath;

    private GatewayConfig(Properties props) {
        this.properties = props;

        this.fetchIntervalSeconds = parseLong("market-data.fetch-interval-seconds", 60);
        this.startupDelaySeconds = parseLong("market-data.startup-delay-seconds", 5);
        this.marketDataInterval = properties.getProperty("market-data.interval", "1m").trim();
        this.marketDataLimit = (int) parseLong("market-data.limit", 100);
        this.channels = parseList("market-data.channels", "kraken,binance,okx,coinbase");

        this.clientOrderIdPrefix = properties.getProperty("orders.client-id-prefix", "AT").trim();

        this.tickBarSize = (int) parseLong("bars.tick-size", 100);
        this.rangeBarThreshold = parseDecimal("bars.range-threshold", BigDecimal.TEN);
        this.renkoBrickSize = parseDecimal("bars.renko-brick-size", BigDecimal.TEN);
        this.renkoAtrPeriod = (int) parseLong("bars.renko-atr-period", 13);
        this.aggregatorShards = (int) parseLong("bars.shards", 4);

        this.binanceTestnet = Boolean.parseBoolean(properties.getProperty("broker.binance.testnet", "true").trim());
        this.databasePath = properties.getProperty("database.path", "algotrendy.db").trim();

        validate();

        logger.info("📊 Gateway Configuration Loaded:");
        logger.info("   Fetch interval: {}s (startup delay {}s)", fetchIntervalSeconds, startupDelaySeconds);
        logger.info("   Channels: {}", channels);
        logger.info("   Bars: tick={} range={} renko={}", tickBarSize, rangeBarThreshold, renkoBrickSize);
        logger.info("   Database: {}", databasePath);
    }

    /**
     * Load configuration from config.properties file.
     */
    public static GatewayConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new GatewayConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load config.properties from filesystem: {}", e.getMessage());
            }
        }

        try (InputStream is = GatewayConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new GatewayConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load config.properties from classpath: {}", e.getMessage());
        }

        logger.warn("No config.properties found, using defaults");
        return new GatewayConfig(props);
    }

    /**
     * Create an instance from explicit properties (tests, embedded use).
     */
    public static GatewayConfig forTest(Properties testProps) {
        return new GatewayConfig(testProps);
    }

    /**
     * Validate configuration using Bean Validation.
     */
    private void validate() {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            var violations = validator.validate(this);

            if (!violations.isEmpty()) {
                var errorMessages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
                throw new InvalidConfigurationException(
                    "Configuration validation failed: " + String.join(", ", errorMessages));
            }
        }
    }

    // ========== Parsing ==========

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private BigDecimal parseDecimal(String key, BigDecimal defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private List<String> parseList(String key, String defaultValue) {
        String value = properties.getProperty(key, defaultValue);
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> s.toLowerCase(Locale.ROOT))
            .toList();
    }

    // ========== Getters ==========

    public long getFetchIntervalSeconds() {
        return fetchIntervalSeconds;
    }

    public long getStartupDelaySeconds() {
        return startupDelaySeconds;
    }

    public String getMarketDataInterval() {
        return marketDataInterval;
    }

    public int getMarketDataLimit() {
        return marketDataLimit;
    }

    /** Lower-cased channel names to run, in configured order. */
    public List<String> getChannels() {
        return channels;
    }

    public String getClientOrderIdPrefix() {
        return clientOrderIdPrefix;
    }

    public int getTickBarSize() {
        return tickBarSize;
    }

    public BigDecimal getRangeBarThreshold() {
        return rangeBarThreshold;
    }

    public BigDecimal getRenkoBrickSize() {
        return renkoBrickSize;
    }

    public int getRenkoAtrPeriod() {
        return renkoAtrPeriod;
    }

    public int getAggregatorShards() {
        return aggregatorShards;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public boolean isBinanceTestnet() {
        return binanceTestnet;
    }

    /**
     * Rate limit for a broker: {@code broker.<name>.max-concurrency} and
     * {@code broker.<name>.min-interval-ms}, each defaulting to the broker's preset.
     */
    public BrokerRateLimit rateLimitFor(String broker) {
        BrokerRateLimit preset = BrokerRateLimit.presetFor(broker);
        String prefix = "broker." + broker.toLowerCase(Locale.ROOT) + ".";
        int maxConcurrency = (int) parseLong(prefix + "max-concurrency", preset.maxConcurrency());
        long minIntervalMs = parseLong(prefix + "min-interval-ms", preset.minIntervalMs());
        return new BrokerRateLimit(maxConcurrency, minIntervalMs);
    }

    /**
     * Secret lookup: environment first, then the properties file. Values are never logged.
     */
    public Optional<String> getCredential(String key) {
        String env = System.getenv(key);
        if (env != null && !env.isBlank()) {
            return Optional.of(env);
        }
        return Optional.ofNullable(properties.getProperty(key))
            .map(String::trim)
            .filter(s -> !s.isEmpty());
    }
}
