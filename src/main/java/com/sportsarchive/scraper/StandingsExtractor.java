package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the league table of an already loaded season page.
 * <p>
 * Workflow:
 * <ul>
 *   <li>A season whose score cells all show the unplayed marker has no standings; a warning is logged.</li>
 *   <li>Otherwise waits for the table rows to appear and stabilize, each with a team name.</li>
 *   <li>Zero parsed rows is a structural error, logged with a snapshot of the standings container.</li>
 *   <li>A table where no team has played a match is degenerate and discarded.</li>
 *   <li>Valid standings are written to {@code standing_<seasonId>.json}.</li>
 * </ul>
 * Issues go to {@code standings_scrape_issues.log} in the season directory.
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class StandingsExtractor {
    private static final Logger logger = LoggerFactory.getLogger(StandingsExtractor.class);
    private static final Pattern LEADING_INT = Pattern.compile("^\\s*([+-]?\\d{1,9})");
    static final String ISSUES_FILE = "standings_scrape_issues.log";

    private final BrowserSessionInterface session;
    private final RetryOrchestrator retry;
    private final StabilizationWait stabilization;
    private final StorageServiceInterface storage;
    private final ScraperConfig config;

    public StandingsExtractor(BrowserSessionInterface session, RetryOrchestrator retry,
                              StabilizationWait stabilization, StorageServiceInterface storage, ScraperConfig config) {
        this.session = session;
        this.retry = retry;
        this.stabilization = stabilization;
        this.storage = storage;
        this.config = config;
    }

    /**
     * @param seasonUrl URL of the loaded season page
     * @param outputDir Season directory for the standings file and issue log
     * @return Valid standings, or an empty list when the season has none
     */
    public List<StandingRow> scrapeLeagueStanding(String seasonUrl, Path outputDir) throws InterruptedException {
        IssueLog issues = new IssueLog(storage, outputDir.resolve(ISSUES_FILE));
        logger.info("Scraping league standing for {}", seasonUrl);
        try {
            if (!PageScripts.asBoolean(session.evaluate(PageScripts.HAS_RESULTS, PageSelectors.SCORE.css()))) {
                String message = "No match results found for this season (e.g., only fixtures available). "
                    + "Skipping standings scrape.";
                issues.warning(seasonUrl, message);
                logger.warn(message);
                return List.of();
            }

            String rows = PageSelectors.STANDING_ROW.css();
            retry.run(() -> {
                session.waitForSelector(rows, config.waitTimeoutMs());
                stabilization.awaitStableRows(session, rows, PageSelectors.STANDING_TEAM.css(),
                    config.waitTimeoutMs(), "standings rows");
            }, "standings table");

            Map<String, Object> columns = new LinkedHashMap<>();
            for (PageSelector column : PageSelectors.STANDING_COLUMNS) {
                columns.put(column.name, column.css());
            }
            List<StandingRow> standings = parseRows(PageScripts.asMapList(
                session.evaluate(PageScripts.STANDING_ROWS, Map.of("row", rows, "columns", columns))));

            if (standings.isEmpty()) {
                String message = "No standings data extracted. Possible issue with table structure or loading.";
                issues.record(Issue.of(seasonUrl, IssueType.ERROR, message).withSnapshot(snapshot()));
                logger.error(message);
                return List.of();
            }

            if (standings.stream().noneMatch(s -> s.matchPlayed() != 0)) {
                logger.info("Standings for {} are degenerate (no matches played). Discarding.", seasonUrl);
                return List.of();
            }

            Path file = outputDir.resolve("standing_" + Utils.seasonIdFromUrl(seasonUrl) + ".json");
            try {
                storage.writeJson(file, standings);
            } catch (IOException e) {
                logger.error("Failed to write {}: {}", file, e.getMessage());
            }
            return standings;
        } catch (InterruptedException | ReconnectionTimeoutException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Error scraping standings: {}", e.getMessage());
            issues.record(Issue.of(seasonUrl, IssueType.ERROR, "Error scraping standings: " + e.getMessage())
                .withSnapshot(snapshot()));
            return List.of();
        }
    }

    /**
     * Converts raw cell text into rows. Rows without a rank or a team are dropped; numeric cells are read like
     * {@code parseInt}, so {@code "+5"} is 5 and anything without a leading integer is 0.
     */
    static List<StandingRow> parseRows(List<Map<String, Object>> raw) {
        List<StandingRow> rows = new ArrayList<>();
        for (Map<String, Object> cells : raw) {
            String rank = PageScripts.asString(cells.get("rank"));
            String team = PageScripts.asString(cells.get("team"));
            if (rank.isEmpty() || team.isEmpty()) continue;
            rows.add(new StandingRow(
                rank,
                team,
                leadingInt(cells.get("matchPlayed")),
                leadingInt(cells.get("won")),
                leadingInt(cells.get("draw")),
                leadingInt(cells.get("lost")),
                leadingInt(cells.get("goalsScored")),
                leadingInt(cells.get("goalsAllowed")),
                leadingInt(cells.get("goalDifference")),
                leadingInt(cells.get("points"))
            ));
        }
        return rows;
    }

    static int leadingInt(Object cell) {
        Matcher m = LEADING_INT.matcher(PageScripts.asString(cell));
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }

    private String snapshot() {
        Map<String, Object> arg = new LinkedHashMap<>();
        arg.put("selector", PageSelectors.STANDINGS_HEADER.css());
        arg.put("parent", true);
        arg.put("limit", 0);
        try {
            Object html = session.evaluate(PageScripts.HTML_SNAPSHOT, arg);
            return html == null ? "No standings container found" : html.toString();
        } catch (RuntimeException e) {
            logger.warn("Could not capture standings snapshot: {}", e.getMessage());
            return "Snapshot unavailable: " + e.getMessage();
        }
    }
}
