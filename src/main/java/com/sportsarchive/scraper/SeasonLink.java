package com.sportsarchive.scraper;

import java.util.List;

/**
 * A season accepted by {@link SeasonDiscovery}: its label (e.g. "2022/2023"), absolute URL, and league standing.
 */
public record SeasonLink(String season, String url, List<StandingRow> leagueStanding) {
    public SeasonLink {
        leagueStanding = leagueStanding == null ? List.of() : List.copyOf(leagueStanding);
    }
}
