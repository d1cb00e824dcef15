package com.sportsarchive.scraper;

import java.util.List;

/**
 * Result of parsing one gameweek's rows: either the extracted matches, or the structural error that aborted
 * extraction.
 */
public record RowExtraction(List<Match> matches, String structuralError) {
    public RowExtraction {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public static RowExtraction success(List<Match> matches) {
        return new RowExtraction(matches, null);
    }

    public static RowExtraction failed(String structuralError) {
        return new RowExtraction(List.of(), structuralError);
    }

    public boolean isSuccess() {
        return structuralError == null;
    }
}
