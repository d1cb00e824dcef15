package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Crawls every gameweek of one season.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Loads the season page; a season without played matches yields a clean, empty outcome.</li>
 *   <li>Reads the number of gameweeks and derives the expected matches per gameweek.</li>
 *   <li>Detects the navigation strategy, moves to gameweek 1, then extracts every gameweek in turn.</li>
 *   <li>Verifies, sequences and saves the result to {@code matches_<seasonId>[.<id>].json}.</li>
 * </ul>
 * Failures become {@code hasErrorOccurred}; only {@link ReconnectionTimeoutException} escapes.
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class SeasonScraper {
    private static final Logger logger = LoggerFactory.getLogger(SeasonScraper.class);
    static final String VERIFICATION_ISSUES_FILE = "gameweek_verification_issues.log";

    private final BrowserSessionInterface session;
    private final RetryOrchestrator retry;
    private final StabilizationWait stabilization;
    private final StorageServiceInterface storage;
    private final ScraperConfig config;
    private final Sleeper sleeper;

    public SeasonScraper(BrowserSessionInterface session, RetryOrchestrator retry, StabilizationWait stabilization,
                         StorageServiceInterface storage, ScraperConfig config, Sleeper sleeper) {
        this.session = session;
        this.retry = retry;
        this.stabilization = stabilization;
        this.storage = storage;
        this.config = config;
        this.sleeper = sleeper;
    }

    /**
     * @param seasonUrl Season page URL
     * @param outputDir Directory for the matches file and issue logs
     * @param uniqueFileId Suffix for rescrape attempts, or null for the first attempt
     * @return Sequenced gameweeks and the season error flag
     * @throws ReconnectionTimeoutException if the network stayed down past the reconnection budget
     */
    public ScrapeOutcome scrapeSeason(String seasonUrl, Path outputDir, String uniqueFileId)
            throws InterruptedException {
        String suffix = uniqueFileId == null || uniqueFileId.isBlank() ? "" : "." + uniqueFileId;
        IssueLog issues = new IssueLog(storage, outputDir.resolve("gameweek_scrape_issues" + suffix + ".log"));
        try {
            storage.mkdirAll(outputDir);
            retry.run(() -> session.navigate(seasonUrl, config.navigationTimeoutMs()), "season page " + seasonUrl);

            if (!PageScripts.asBoolean(session.evaluate(PageScripts.HAS_RESULTS, PageSelectors.SCORE.css()))) {
                issues.warning(seasonUrl,
                    "No match results found for this season (e.g., only fixtures available). Skipping season.");
                logger.warn("No match results found for this season. Skipping.");
                return new ScrapeOutcome(false, List.of());
            }

            int maxGameweeks = GameweekNavigator.maxWeek(session);
            int expected = GameweekExtractor.expectedMatchesPerGameweek(maxGameweeks,
                config.expectedMatchesPerGameweek());
            logger.info("Found {} gameweeks to scrape. Expecting ~{} matches per gameweek{}.", maxGameweeks, expected,
                config.expectedMatchesPerGameweek() > 0 ? " (configured)" : " (assuming double round-robin)");

            GameweekNavigator navigator = GameweekNavigator.detect(session, retry, config.waitTimeoutMs());
            navigator.navigateTo(1);

            GameweekExtractor extractor = new GameweekExtractor(session, retry, stabilization, config, issues,
                seasonUrl, expected);
            List<Gameweek> accepted = new ArrayList<>();
            for (int week = 1; week <= maxGameweeks; week++) {
                logger.info("Scraping gameweek {}...", week);
                Optional<Gameweek> gameweek = extractor.scrapeGameweek(week, navigator);
                if (gameweek.isEmpty()) continue;
                accepted.add(gameweek.get());
                Utils.politePause(sleeper, config.pageDelayMs(), config.jitterMs());
            }

            IssueLog verificationLog = new IssueLog(storage, outputDir.resolve(VERIFICATION_ISSUES_FILE));
            VerificationReport report = new GameweekVerifier(config.sparsityThreshold())
                .verify(accepted, expected, seasonUrl, verificationLog);
            List<Gameweek> sequenced = GameweekSequencer.sortByDate(report.data());

            Path file = outputDir.resolve("matches_" + Utils.seasonIdFromUrl(seasonUrl) + suffix + ".json");
            try {
                storage.writeJson(file, sequenced);
                logger.info("Results saved to {}", file);
            } catch (IOException e) {
                logger.error("Failed to write {}: {}", file, e.getMessage());
            }
            return new ScrapeOutcome(extractor.hasErrorOccurred(), sequenced);
        } catch (InterruptedException | ReconnectionTimeoutException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Error scraping season: {}", e.getMessage());
            issues.error(seasonUrl, e.getMessage());
            return ScrapeOutcome.failed();
        }
    }
}
