package com.sportsarchive.scraper;

/**
 * The page did not have the expected structure (missing element, malformed row). Never retried by
 * {@link RetryOrchestrator}; handled by the gameweek-level retry of {@link GameweekExtractor}.
 */
public class StructuralExtractionException extends RuntimeException {
    public StructuralExtractionException(String message) {
        super(message);
    }
}
