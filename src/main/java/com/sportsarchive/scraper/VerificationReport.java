package com.sportsarchive.scraper;

import java.util.List;

/**
 * Outcome of {@link GameweekVerifier#verify}: the gameweeks, unmodified, and every issue raised while checking them.
 */
public record VerificationReport(List<Gameweek> data, List<Issue> issues) {
    public VerificationReport {
        data = data == null ? List.of() : List.copyOf(data);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
