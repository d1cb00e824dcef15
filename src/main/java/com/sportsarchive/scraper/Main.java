package com.sportsarchive.scraper;

import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Main entry point for the sports archive gameweek crawler.
 * This application walks the competition catalog country by country and crawls every tournament's seasons into
 * the data directory.
 * <p>
 * Usage: {@code Main [continent] [splitCountry]}. Arguments override {@code scraper.catalog.continent} and
 * {@code scraper.catalog.splitCountry}; pass {@code all} as continent to read every catalog file.
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Wires the crawl pipeline for one browser session.
     * @param session Session used serially by every component
     * @param config Crawler configuration
     * @param storage Artifact storage
     * @param sleeper Sleeper for backoff, polling and politeness delays
     * @param probe Reachability probe used while waiting for the network to return
     * @return Composer bound to the session
     */
    static TournamentComposer composerFor(BrowserSessionInterface session, ScraperConfig config,
                                          StorageServiceInterface storage, Sleeper sleeper, ReachabilityProbe probe) {
        RetryOrchestrator retry = new RetryOrchestrator(config, sleeper, probe);
        StabilizationWait stabilization = new StabilizationWait(sleeper, System::currentTimeMillis,
            config.stabilizationPollMs());
        StandingsExtractor standings = new StandingsExtractor(session, retry, stabilization, storage, config);
        SeasonDiscovery discovery = new SeasonDiscovery(session, retry, stabilization, standings, storage, config,
            sleeper);
        SeasonScraper seasonScraper = new SeasonScraper(session, retry, stabilization, storage, config, sleeper);
        return new TournamentComposer(discovery, seasonScraper, storage, config, sleeper, System::currentTimeMillis);
    }

    /**
     * Creates the country directory and records the country name in its {@code metadata.txt} once.
     * @return The country directory
     */
    static Path prepareCountryDir(StorageServiceInterface storage, Path outputDir, String country) throws IOException {
        Path countryDir = outputDir.resolve(Utils.normalizeFilepath(country));
        storage.mkdirAll(countryDir);
        Path metadata = countryDir.resolve("metadata.txt");
        if (!storage.exists(metadata)) {
            storage.appendText(metadata, "Country = " + country);
        }
        return countryDir;
    }

    /**
     * Main application entry point.
     * @param args Optional continent and split country
     */
    public static void main(String[] args) {
        ScraperConfig config = ScraperConfig.load();
        String continent = args != null && args.length > 0 ? args[0].trim() : config.continent();
        if ("all".equalsIgnoreCase(continent)) continent = null;
        String splitCountry = args != null && args.length > 1 ? args[1].trim() : config.splitCountry();

        StorageServiceInterface storage = new StorageService();
        ReachabilityProbe probe = new HttpReachabilityProbe(config.probeUrl());
        List<Competition> competitions = new CompetitionCatalog(storage, config.catalogDir())
            .getCompetitionUrls(continent, splitCountry);
        logger.info("{} countries about to be processed...", competitions.size());

        try {
            storage.mkdirAll(config.outputDir());
        } catch (IOException e) {
            logger.error("Failed to create data directory {}: {}", config.outputDir(), e.getMessage());
            return;
        }

        try (Playwright playwright = Playwright.create()) {
            for (int i = 0; i < competitions.size(); i++) {
                Competition competition = competitions.get(i);
                logger.info("Scraping {}/{} countries: {}", i + 1, competitions.size(), competition.country());
                Path countryDir = prepareCountryDir(storage, config.outputDir(), competition.country());
                List<Tournament> tournaments = competition.tournaments();
                for (int j = 0; j < tournaments.size(); j++) {
                    Tournament tournament = tournaments.get(j);
                    logger.info("[{}/{}] Scraping {} in {}", j + 1, tournaments.size(), tournament.name(),
                        competition.country());
                    try (PlaywrightBrowserSession session = PlaywrightBrowserSession.open(playwright, config)) {
                        composerFor(session, config, storage, Sleeper.THREAD, probe)
                            .scrapeTournament(tournament.name(), tournament.url(), countryDir);
                    } catch (PlaywrightException e) {
                        logger.error("Browser failure while scraping {}: {}", tournament.name(), e.getMessage());
                    }
                }
            }
            logger.info("Scraping completed.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Scraping interrupted.");
        } catch (Exception e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
        }
    }
}
