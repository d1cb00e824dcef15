package com.sportsarchive.scraper;

import java.util.List;

/**
 * Outcome of {@link SeasonDiscovery#discoverSeasons}. Only {@code FOUND} carries seasons, and even then the list
 * may be empty when no candidate season had valid standings.
 */
public record SeasonDiscoveryResult(Status status, List<SeasonLink> seasons) {
    public enum Status { FOUND, NOT_A_LEAGUE, NO_SEASONS, FAILED }

    public SeasonDiscoveryResult {
        seasons = seasons == null ? List.of() : List.copyOf(seasons);
    }

    public static SeasonDiscoveryResult of(Status status) {
        return new SeasonDiscoveryResult(status, List.of());
    }

    public boolean isEmpty() {
        return seasons.isEmpty();
    }
}
