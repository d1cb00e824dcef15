package com.sportsarchive.scraper;

/**
 * One team's line in a season's league table.
 */
public record StandingRow(
    String rank,
    String team,
    int matchPlayed,
    int won,
    int draw,
    int lost,
    int goalsScored,
    int goalsAllowed,
    int goalDifference,
    int points
) {}
