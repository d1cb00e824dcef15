package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Post-pass over a season's accepted gameweeks.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Duplicate signatures across all gameweeks are logged as an error and raise {@link DataIntegrityException}.</li>
 *   <li>Non-empty gameweeks below the sparsity floor, gameweeks with missing or malformed dates, and empty gameweeks
 *   are logged as warnings.</li>
 * </ul>
 * The data is returned unchanged.
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class GameweekVerifier {
    private static final Logger logger = LoggerFactory.getLogger(GameweekVerifier.class);

    private final double sparsityThreshold;

    public GameweekVerifier(double sparsityThreshold) {
        this.sparsityThreshold = sparsityThreshold;
    }

    /**
     * @param gameweeks Accepted gameweeks in navigation order
     * @param expectedMatches Expected matches per gameweek
     * @param seasonUrl Season URL recorded on every issue
     * @param log Destination of the issues ({@code gameweek_verification_issues.log})
     * @return The unmodified gameweeks and the warnings raised
     * @throws DataIntegrityException if any match signature occurs more than once
     */
    public VerificationReport verify(List<Gameweek> gameweeks, int expectedMatches, String seasonUrl, IssueLog log) {
        List<Issue> report = new ArrayList<>();

        Set<String> signatures = new HashSet<>();
        List<Map<String, Object>> duplicates = new ArrayList<>();
        for (Gameweek gw : gameweeks) {
            for (int i = 0; i < gw.matches().size(); i++) {
                Match match = gw.matches().get(i);
                if (!signatures.add(match.signature())) {
                    Map<String, Object> duplicate = new LinkedHashMap<>();
                    duplicate.put("gameweek", gw.number());
                    duplicate.put("matchIndex", i);
                    duplicate.put("match", match);
                    duplicates.add(duplicate);
                }
            }
        }
        if (!duplicates.isEmpty()) {
            report(log, report, Issue.of(seasonUrl, IssueType.ERROR, "Found " + duplicates.size()
                + " duplicate matches").withDetails(Map.of("duplicates", duplicates)));
            throw new DataIntegrityException("Duplicate matches detected: " + duplicates.size()
                + " instances. See " + log.file().getFileName() + " for details.", duplicates);
        }

        int floor = GameweekExtractor.sparsityFloor(expectedMatches, sparsityThreshold);
        for (Gameweek gw : gameweeks) {
            int count = gw.matches().size();
            if (count > 0 && count < floor) {
                report(log, report, Issue.of(seasonUrl, IssueType.WARNING, "Gameweek " + gw.number()
                        + " has fewer matches than expected: " + count + " found, expected ~" + expectedMatches)
                    .withGameweek(gw.number()).withDetails(Map.of("matches", gw.matches())));
            }
        }

        for (Gameweek gw : gameweeks) {
            List<Match> invalid = gw.matches().stream().filter(m -> !m.hasValidDate()).toList();
            if (!invalid.isEmpty()) {
                report(log, report, Issue.of(seasonUrl, IssueType.WARNING, "Gameweek " + gw.number()
                        + " contains matches with invalid or missing dates")
                    .withGameweek(gw.number()).withDetails(Map.of("invalidMatches", invalid)));
            }
        }

        for (Gameweek gw : gameweeks) {
            if (gw.matches().isEmpty()) {
                report(log, report, Issue.of(seasonUrl, IssueType.WARNING, "Gameweek " + gw.number()
                    + " is empty (no matches)").withGameweek(gw.number()));
            }
        }

        return new VerificationReport(gameweeks, report);
    }

    private static void report(IssueLog log, List<Issue> report, Issue issue) {
        log.record(issue);
        report.add(issue);
        if (issue.type() == IssueType.ERROR) {
            logger.error("[{}] {}", issue.type().label(), issue.message());
        } else {
            logger.warn("[{}] {}", issue.type().label(), issue.message());
        }
    }
}
