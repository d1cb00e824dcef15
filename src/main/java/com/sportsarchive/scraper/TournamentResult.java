package com.sportsarchive.scraper;

import java.util.List;

/**
 * Tournament-level artifact written as {@code composed.json}, {@code repaired.json} or {@code erroneous.json}.
 */
public record TournamentResult(String tournament, List<SeasonResult> data) {}
