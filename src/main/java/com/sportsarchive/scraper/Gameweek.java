package com.sportsarchive.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A round of fixtures. Before sequencing, {@code number} is the navigation index the round was scraped from;
 * after {@link GameweekSequencer#sortByDate(List)} it is the chronological position, starting at 1.
 */
public record Gameweek(@JsonProperty("gameweek") int number, List<Match> matches) {
    public Gameweek {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
