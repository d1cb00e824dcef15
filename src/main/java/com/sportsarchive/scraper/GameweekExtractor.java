package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts the matches of one gameweek at a time for a single season crawl attempt.
 * <p>
 * Workflow for each gameweek:
 * <ul>
 *   <li>Navigate to the index and wait for the match rows to appear and stabilize.</li>
 *   <li>Parse the rows with {@link MatchRowParser}. A row missing a team or stats link is a structural error.</li>
 *   <li>Reject the gameweek on a duplicate anomaly (a signature already accepted this season) or a sparsity anomaly
 *   (fewer than {@code floor(expected * threshold)} matches).</li>
 *   <li>Every failure or anomaly is logged and raises the season error flag; the gameweek is retried up to the
 *   configured attempt count, then skipped.</li>
 *   <li>On success the signatures are merged into the season set.</li>
 * </ul>
 * The signature set is owned by this instance; create one extractor per season attempt.
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class GameweekExtractor {
    private static final Logger logger = LoggerFactory.getLogger(GameweekExtractor.class);

    private final BrowserSessionInterface session;
    private final RetryOrchestrator retry;
    private final StabilizationWait stabilization;
    private final ScraperConfig config;
    private final IssueLog issues;
    private final String seasonUrl;
    private final int expectedMatches;
    private final Set<String> acceptedSignatures = new HashSet<>();
    private boolean errorSignal;

    public GameweekExtractor(BrowserSessionInterface session, RetryOrchestrator retry, StabilizationWait stabilization,
                             ScraperConfig config, IssueLog issues, String seasonUrl, int expectedMatches) {
        this.session = session;
        this.retry = retry;
        this.stabilization = stabilization;
        this.config = config;
        this.issues = issues;
        this.seasonUrl = seasonUrl;
        this.expectedMatches = expectedMatches;
    }

    /**
     * Expected matches per gameweek: the configured value when positive, otherwise
     * {@code floor((maxGameweeks + 2) / 2 / 2)}, which assumes a double round-robin.
     */
    public static int expectedMatchesPerGameweek(int maxGameweeks, int configured) {
        if (configured > 0) return configured;
        return (maxGameweeks + 2) / 2 / 2;
    }

    /**
     * Minimum match count below which a gameweek is considered sparse.
     */
    public static int sparsityFloor(int expectedMatches, double threshold) {
        return (int) Math.floor(expectedMatches * threshold);
    }

    /**
     * Scrapes one gameweek with bounded retry.
     * @param week Navigation index
     * @param navigator Navigator bound to the season page
     * @return The accepted gameweek, or empty when every attempt failed
     * @throws ReconnectionTimeoutException if the network did not come back; never retried here
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Gameweek> scrapeGameweek(int week, GameweekNavigator navigator) throws InterruptedException {
        int maxAttempts = Math.max(1, config.gameweekMaxAttempts());
        for (int retryCount = 0; retryCount < maxAttempts; retryCount++) {
            try {
                navigator.navigateTo(week);
                List<Match> matches = extractCurrent(week);
                if (accept(week, matches)) {
                    logger.info("Gameweek {}: {} matches.", week, matches.size());
                    return Optional.of(new Gameweek(week, matches));
                }
                logger.warn("Gameweek {} rejected on attempt {}/{}. Retrying...", week, retryCount + 1, maxAttempts);
            } catch (ReconnectionTimeoutException | InterruptedException e) {
                throw e;
            } catch (Exception e) {
                errorSignal = true;
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("retryCount", retryCount);
                issues.record(Issue.of(seasonUrl, IssueType.ERROR, "Failed to scrape gameweek " + week + ": "
                    + e.getMessage()).withGameweek(week).withDetails(details));
                logger.error("Failed to scrape gameweek {}: {}", week, e.getMessage());
            }
        }
        errorSignal = true;
        logger.warn("Skipping gameweek {} after {} failed attempts.", week, maxAttempts);
        return Optional.empty();
    }

    private List<Match> extractCurrent(int week) throws Exception {
        String rows = PageSelectors.WEEK_MATCH_ROWS.css();
        retry.run(() -> {
            session.waitForSelector(rows, config.waitTimeoutMs());
            stabilization.awaitStableRows(session, rows, PageSelectors.TEAM_NAME.css(), config.waitTimeoutMs(),
                "gameweek " + week + " match rows");
        }, "match rows of gameweek " + week);

        Map<String, Object> arg = new LinkedHashMap<>();
        arg.put("container", PageSelectors.WEEK_CONTAINER.css());
        arg.put("row", PageSelectors.MATCH_ROW.css());
        arg.put("time", PageSelectors.MATCH_TIME.css());
        arg.put("home", PageSelectors.HOME_TEAM.css());
        arg.put("score", PageSelectors.SCORE.css());
        arg.put("away", PageSelectors.AWAY_TEAM.css());
        RowExtraction extraction = MatchRowParser.parse(
            PageScripts.asMapList(session.evaluate(PageScripts.MATCH_ROWS, arg)), config.baseUrl());
        if (!extraction.isSuccess()) {
            throw new StructuralExtractionException(extraction.structuralError());
        }
        return extraction.matches();
    }

    /**
     * Applies the duplicate and sparsity checks and merges the signatures when the gameweek passes both.
     * @return true when the gameweek is accepted
     */
    boolean accept(int week, List<Match> matches) {
        Set<String> seenThisWeek = new HashSet<>();
        List<Map<String, Object>> duplicates = new ArrayList<>();
        for (int i = 0; i < matches.size(); i++) {
            Match match = matches.get(i);
            String signature = match.signature();
            if (acceptedSignatures.contains(signature) || !seenThisWeek.add(signature)) {
                Map<String, Object> duplicate = new LinkedHashMap<>();
                duplicate.put("match", match);
                duplicate.put("index", i);
                duplicates.add(duplicate);
            }
        }
        if (!duplicates.isEmpty()) {
            errorSignal = true;
            issues.record(Issue.of(seasonUrl, IssueType.WARNING, "Found " + duplicates.size()
                    + " duplicate matches in gameweek " + week)
                .withGameweek(week).withDetails(Map.of("duplicates", duplicates)));
            return false;
        }

        int floor = sparsityFloor(expectedMatches, config.sparsityThreshold());
        if (matches.size() < floor) {
            errorSignal = true;
            issues.record(Issue.of(seasonUrl, IssueType.WARNING, "Gameweek " + week
                    + " has fewer matches than expected: " + matches.size() + " found, expected ~" + expectedMatches)
                .withGameweek(week).withDetails(Map.of("matches", matches)));
            return false;
        }

        acceptedSignatures.addAll(seenThisWeek);
        return true;
    }

    public boolean hasErrorOccurred() {
        return errorSignal;
    }

    public int expectedMatches() {
        return expectedMatches;
    }
}
