package com.sportsarchive.scraper;

import java.util.List;

/**
 * One season entry of a {@link TournamentResult} artifact.
 */
public record SeasonResult(String season, List<Gameweek> gameweeks, List<StandingRow> leagueStanding) {}
