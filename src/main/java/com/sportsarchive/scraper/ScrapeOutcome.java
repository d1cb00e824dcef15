package com.sportsarchive.scraper;

import java.util.List;

/**
 * Result of one season crawl attempt. {@code hasErrorOccurred} is raised by any gameweek anomaly, skipped gameweek,
 * or season-level failure and drives the rescrape policy of {@link TournamentComposer}.
 */
public record ScrapeOutcome(boolean hasErrorOccurred, List<Gameweek> result) {
    public ScrapeOutcome {
        result = result == null ? List.of() : List.copyOf(result);
    }

    public static ScrapeOutcome failed() {
        return new ScrapeOutcome(true, List.of());
    }
}
