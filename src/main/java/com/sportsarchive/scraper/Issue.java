package com.sportsarchive.scraper;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only issue log entry. Written once by {@link IssueLog} and never mutated.
 * {@code gameweek}, {@code details} and {@code htmlSnapshot} are omitted from the log when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Issue(
    String timestamp,
    String seasonUrl,
    IssueType type,
    Integer gameweek,
    String message,
    Map<String, Object> details,
    String htmlSnapshot
) {
    public static Issue of(String seasonUrl, IssueType type, String message) {
        return new Issue(Instant.now().toString(), seasonUrl, type, null, message, null, null);
    }

    public Issue withGameweek(Integer week) {
        return new Issue(timestamp, seasonUrl, type, week, message, details, htmlSnapshot);
    }

    public Issue withDetails(Map<String, Object> newDetails) {
        return new Issue(timestamp, seasonUrl, type, gameweek, message, newDetails, htmlSnapshot);
    }

    public Issue withSnapshot(String snapshot) {
        return new Issue(timestamp, seasonUrl, type, gameweek, message, details, snapshot);
    }
}
