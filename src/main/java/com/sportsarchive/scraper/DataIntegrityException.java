package com.sportsarchive.scraper;

import java.util.List;
import java.util.Map;

/**
 * Duplicate matches survived accept-time deduplication. Fatal for the season crawl attempt.
 */
public class DataIntegrityException extends RuntimeException {
    private final List<Map<String, Object>> duplicates;

    public DataIntegrityException(String message, List<Map<String, Object>> duplicates) {
        super(message);
        this.duplicates = duplicates == null ? List.of() : List.copyOf(duplicates);
    }

    public List<Map<String, Object>> getDuplicates() {
        return duplicates;
    }
}
