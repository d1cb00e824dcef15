package com.sportsarchive.scraper;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.regex.Pattern;

/**
 * Immutable record representing one fixture row of a gameweek.
 * <p>
 * {@code score} is {@code ":"} for fixtures that have not been played, {@code time} is {@code "TBD"} when the site
 * shows no kick-off time, and {@code awarded} is only present (true) for results awarded by decision.
 * <p>
 * The deduplication identity is {@link #signature()}: home team, away team, date and score. The site does not
 * guarantee this tuple to be unique, so a repeated signature within a season is treated as a scraping artifact.
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Match(
    String date,
    String time,
    String homeTeam,
    String awayTeam,
    String score,
    String statsUrl,
    Boolean awarded
) {
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    public String signature() {
        return homeTeam + "|" + awayTeam + "|" + date + "|" + score;
    }

    public boolean hasValidDate() {
        return isoDate(date);
    }

    static boolean isoDate(String value) {
        return value != null && ISO_DATE.matcher(value).matches();
    }
}
