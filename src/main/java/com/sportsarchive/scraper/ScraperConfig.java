package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Immutable crawler configuration.
 * <p>
 * Values come from {@code scraper.properties} on the classpath. When loaded with {@link #load()}, each key can be
 * overridden by a Java system property of the same name, and then by an environment variable whose name is the key
 * upper-cased with dots replaced by underscores (e.g. {@code SCRAPER_SEASONS_FROM} for {@code scraper.seasons.from}).
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public record ScraperConfig(
    String baseUrl,
    Path outputDir,
    Path catalogDir,
    String continent,
    String splitCountry,
    int seasonsFrom,
    int seasonsTo,
    boolean leaguesOnly,
    boolean headless,
    int navigationTimeoutMs,
    int waitTimeoutMs,
    int stabilizationPollMs,
    int retryMaxAttempts,
    int backoffBase,
    String probeUrl,
    long reconnectPollMs,
    long reconnectMaxWaitMs,
    int gameweekMaxAttempts,
    int expectedMatchesPerGameweek,
    double sparsityThreshold,
    long seasonDelayMs,
    long pageDelayMs,
    long jitterMs,
    int maxRescrapeCount
) {
    private static final Logger logger = LoggerFactory.getLogger(ScraperConfig.class);
    private static final String RESOURCE = "scraper.properties";

    /**
     * Loads classpath defaults, then applies system property and environment overrides.
     */
    public static ScraperConfig load() {
        Properties props = classpathDefaults();
        for (String key : props.stringPropertyNames()) {
            String override = envOrProp(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    /**
     * Builds a configuration from classpath defaults with the given overrides applied on top.
     * Environment variables and system properties are ignored.
     */
    public static ScraperConfig withOverrides(Properties overrides) {
        Properties props = classpathDefaults();
        if (overrides != null) {
            props.putAll(overrides);
        }
        return fromProperties(props);
    }

    public static ScraperConfig defaults() {
        return withOverrides(null);
    }

    private static ScraperConfig fromProperties(Properties p) {
        return new ScraperConfig(
            p.getProperty("scraper.baseUrl", "https://globalsportsarchive.com"),
            Paths.get(p.getProperty("scraper.outputDir", "data")),
            Paths.get(p.getProperty("scraper.catalog.dir", "competitions")),
            blankToNull(p.getProperty("scraper.catalog.continent")),
            blankToNull(p.getProperty("scraper.catalog.splitCountry")),
            intValue(p, "scraper.seasons.from", 2019),
            intValue(p, "scraper.seasons.to", 2025),
            Boolean.parseBoolean(p.getProperty("scraper.leaguesOnly", "true")),
            Boolean.parseBoolean(p.getProperty("scraper.browser.headless", "true")),
            intValue(p, "scraper.timeout.navigationMs", 60_000),
            intValue(p, "scraper.timeout.waitMs", 45_000),
            intValue(p, "scraper.stabilization.pollMs", 500),
            intValue(p, "scraper.retry.maxAttempts", 3),
            intValue(p, "scraper.retry.backoffBase", 2),
            p.getProperty("scraper.retry.reconnect.probeUrl", "https://www.google.com"),
            longValue(p, "scraper.retry.reconnect.pollMs", 5_000L),
            longValue(p, "scraper.retry.reconnect.maxWaitMs", 600_000L),
            intValue(p, "scraper.gameweek.maxAttempts", 3),
            intValue(p, "scraper.gameweek.expectedMatches", 0),
            doubleValue(p, "scraper.gameweek.sparsityThreshold", 0.5),
            longValue(p, "scraper.delay.seasonMs", 5_000L),
            longValue(p, "scraper.delay.pageMs", 3_000L),
            longValue(p, "scraper.delay.jitterMs", 2_000L),
            intValue(p, "scraper.rescrape.maxCount", 3)
        );
    }

    private static Properties classpathDefaults() {
        Properties props = new Properties();
        try (InputStream in = ScraperConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warn("{} not found on classpath; using built-in defaults.", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}. Using built-in defaults.", RESOURCE, e.getMessage());
        }
        return props;
    }

    private static String envOrProp(String key) {
        String envKey = key.toUpperCase(Locale.ROOT).replace('.', '_');
        String ev = System.getenv(envKey);
        if (ev != null) return ev;
        return System.getProperty(key);
    }

    private static int intValue(Properties p, String key, int defaultVal) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}: '{}'. Using {}.", key, raw, defaultVal);
            return defaultVal;
        }
    }

    private static long longValue(Properties p, String key, long defaultVal) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid number for {}: '{}'. Using {}.", key, raw, defaultVal);
            return defaultVal;
        }
    }

    private static double doubleValue(Properties p, String key, double defaultVal) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid decimal for {}: '{}'. Using {}.", key, raw, defaultVal);
            return defaultVal;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
