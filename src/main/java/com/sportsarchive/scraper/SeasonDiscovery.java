package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Enumerates the seasons of a tournament and keeps those with a played league table.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Loads the tournament page and waits for the season selector's option count to settle.</li>
 *   <li>In league-only mode, tournaments without a {@code Gameweek N} label are skipped.</li>
 *   <li>Candidate seasons are filtered by {@link SeasonRange}; each is loaded and checked with the
 *   {@link StandingsExtractor}.</li>
 *   <li>Accepted seasons are saved to {@code seasons_list.json}.</li>
 * </ul>
 * Issues go to {@code seasons_scrape_issues.log} in the tournament directory.
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class SeasonDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(SeasonDiscovery.class);
    private static final Pattern GAMEWEEK_LABEL = Pattern.compile("^Gameweek\\s+\\d+", Pattern.CASE_INSENSITIVE);
    private static final int SNAPSHOT_LIMIT = 2000;
    static final String ISSUES_FILE = "seasons_scrape_issues.log";
    static final String SEASONS_FILE = "seasons_list.json";

    private final BrowserSessionInterface session;
    private final RetryOrchestrator retry;
    private final StabilizationWait stabilization;
    private final StandingsExtractor standings;
    private final StorageServiceInterface storage;
    private final ScraperConfig config;
    private final Sleeper sleeper;

    public SeasonDiscovery(BrowserSessionInterface session, RetryOrchestrator retry, StabilizationWait stabilization,
                           StandingsExtractor standings, StorageServiceInterface storage, ScraperConfig config,
                           Sleeper sleeper) {
        this.session = session;
        this.retry = retry;
        this.stabilization = stabilization;
        this.standings = standings;
        this.storage = storage;
        this.config = config;
        this.sleeper = sleeper;
    }

    /**
     * @param pageUrl Tournament landing page
     * @param outputDir Tournament directory
     * @param leaguesOnly Skip tournaments without gameweek navigation
     * @return Accepted seasons with their standings, or the reason there are none
     */
    public SeasonDiscoveryResult discoverSeasons(String pageUrl, Path outputDir, boolean leaguesOnly)
            throws InterruptedException {
        IssueLog issues = new IssueLog(storage, outputDir.resolve(ISSUES_FILE));
        try {
            storage.mkdirAll(outputDir);
            retry.run(() -> session.navigate(pageUrl, config.navigationTimeoutMs()), "tournament page " + pageUrl);
            retry.run(() -> {
                session.waitForSelector(PageSelectors.SELECT.css(), config.waitTimeoutMs());
                stabilization.awaitStable(this::seasonOptionState, config.waitTimeoutMs(), "season selector options");
            }, "season selector");

            if (leaguesOnly && !isLeagueCompetition()) {
                issues.warning(pageUrl, "Non-league season skipped");
                logger.warn("Not a league competition, skipping: {}", pageUrl);
                return SeasonDiscoveryResult.of(SeasonDiscoveryResult.Status.NOT_A_LEAGUE);
            }

            List<Map<String, Object>> options = PageScripts.asMapList(
                session.evaluate(PageScripts.SEASON_OPTIONS, PageSelectors.SELECT.css()));
            if (options.isEmpty()) {
                issues.record(Issue.of(pageUrl, IssueType.ERROR,
                    "No seasons found in dropdown. Possible issue with selector or dynamic loading.")
                    .withSnapshot(bodySnapshot()));
                logger.error("No seasons found in dropdown.");
                return SeasonDiscoveryResult.of(SeasonDiscoveryResult.Status.NO_SEASONS);
            }

            SeasonRange range = SeasonRange.of(config);
            List<Map<String, Object>> candidates = options.stream()
                .filter(o -> range.contains(PageScripts.asString(o.get("season"))))
                .toList();
            logger.info("Found {} seasons to check: {}", candidates.size(),
                String.join(", ", candidates.stream().map(o -> PageScripts.asString(o.get("season"))).toList()));

            List<SeasonLink> accepted = new ArrayList<>();
            for (Map<String, Object> candidate : candidates) {
                String season = PageScripts.asString(candidate.get("season"));
                String seasonUrl = Utils.absoluteUrl(config.baseUrl(), PageScripts.asString(candidate.get("url")));
                checkSeason(season, seasonUrl, outputDir, issues).ifPresent(accepted::add);
                Utils.politePause(sleeper, config.pageDelayMs(), config.jitterMs());
            }

            List<Map<String, String>> listing = new ArrayList<>();
            for (SeasonLink link : accepted) {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("season", link.season());
                entry.put("url", link.url());
                listing.add(entry);
            }
            Path listFile = outputDir.resolve(SEASONS_FILE);
            try {
                storage.writeJson(listFile, listing);
                logger.info("Valid seasons saved to {}", listFile);
            } catch (IOException e) {
                logger.error("Failed to write {}: {}", listFile, e.getMessage());
            }
            return new SeasonDiscoveryResult(SeasonDiscoveryResult.Status.FOUND, accepted);
        } catch (InterruptedException | ReconnectionTimeoutException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Error scraping seasons dropdown: {}", e.getMessage());
            issues.record(Issue.of(pageUrl, IssueType.ERROR, "Error scraping seasons dropdown: " + e.getMessage())
                .withSnapshot(bodySnapshot()));
            return SeasonDiscoveryResult.of(SeasonDiscoveryResult.Status.FAILED);
        }
    }

    private Optional<SeasonLink> checkSeason(String season, String seasonUrl, Path outputDir,
                                        IssueLog issues) throws InterruptedException {
        logger.info("Checking season {}...", season);
        try {
            retry.run(() -> session.navigate(seasonUrl, config.navigationTimeoutMs()), "season page " + seasonUrl);
            List<StandingRow> table = standings.scrapeLeagueStanding(seasonUrl,
                outputDir.resolve(Utils.normalizeFilepath(season)));
            if (!table.isEmpty()) {
                logger.info("Season {} has match results and will be scraped.", season);
                return Optional.of(new SeasonLink(season, seasonUrl, table));
            }
            issues.warning(seasonUrl, "No match results found for season " + season + ". Skipping.");
            logger.warn("No match results found for season {}. Skipping.", season);
        } catch (InterruptedException | ReconnectionTimeoutException e) {
            throw e;
        } catch (Exception e) {
            issues.error(seasonUrl, "Error checking season " + season + ": " + e.getMessage());
            logger.error("Error checking season {}: {}", season, e.getMessage());
        }
        return Optional.empty();
    }

    private StabilizationWait.RowState seasonOptionState() {
        int count = PageScripts.asInt(session.evaluate(PageScripts.SEASON_OPTION_COUNT, PageSelectors.SELECT.css()), -1);
        return new StabilizationWait.RowState(Math.max(count, 0), count > 0);
    }

    private boolean isLeagueCompetition() {
        String label = PageScripts.asString(session.evaluate(PageScripts.TEXT_OF, PageSelectors.WEEK_LABEL.css()));
        return GAMEWEEK_LABEL.matcher(label).find();
    }

    private String bodySnapshot() {
        Map<String, Object> arg = new LinkedHashMap<>();
        arg.put("selector", PageSelectors.PAGE_BODY.css());
        arg.put("parent", false);
        arg.put("limit", SNAPSHOT_LIMIT);
        try {
            Object html = session.evaluate(PageScripts.HTML_SNAPSHOT, arg);
            return html == null || html.toString().isEmpty() ? "No header content found" : html.toString();
        } catch (RuntimeException e) {
            logger.warn("Could not capture page snapshot: {}", e.getMessage());
            return "Snapshot unavailable: " + e.getMessage();
        }
    }
}
