package com.sportsarchive.scraper;

import org.junit.jupiter.api.*;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ScraperConfigTest {
    @Test
    void testClasspathDefaults() {
        ScraperConfig config = ScraperConfig.defaults();
        assertEquals("https://globalsportsarchive.com", config.baseUrl());
        assertEquals(Paths.get("data"), config.outputDir());
        assertEquals(2019, config.seasonsFrom());
        assertEquals(2025, config.seasonsTo());
        assertEquals(3, config.retryMaxAttempts());
        assertEquals(600_000L, config.reconnectMaxWaitMs());
        assertEquals(0.5, config.sparsityThreshold());
        assertEquals(3, config.maxRescrapeCount());
        assertNull(config.splitCountry());
    }

    @Test
    void testOverridesAndInvalidValues() {
        Properties overrides = new Properties();
        overrides.setProperty("scraper.seasons.from", "2021");
        overrides.setProperty("scraper.gameweek.expectedMatches", "10");
        overrides.setProperty("scraper.retry.maxAttempts", "many");
        overrides.setProperty("scraper.catalog.splitCountry", "Malta");

        ScraperConfig config = ScraperConfig.withOverrides(overrides);

        assertEquals(2021, config.seasonsFrom());
        assertEquals(10, config.expectedMatchesPerGameweek());
        assertEquals(3, config.retryMaxAttempts());
        assertEquals("Malta", config.splitCountry());
    }
}
