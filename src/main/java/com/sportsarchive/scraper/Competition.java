package com.sportsarchive.scraper;

import java.util.List;

/**
 * Catalog entry grouping a country's tournaments.
 */
public record Competition(String country, List<Tournament> tournaments) {
    public Competition {
        tournaments = tournaments == null ? List.of() : List.copyOf(tournaments);
    }
}
