package com.sportsarchive.scraper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inclusive range of season start years, e.g. 2019..2025 accepts "2019/2020" through "2025/2026".
 */
public record SeasonRange(int fromYear, int toYear) {
    private static final Pattern LABEL = Pattern.compile("(\\d{4})(?:/(\\d{4}))?");

    public SeasonRange {
        if (fromYear > toYear) {
            throw new IllegalArgumentException("Season range start " + fromYear + " is after end " + toYear);
        }
    }

    public static SeasonRange of(ScraperConfig config) {
        return new SeasonRange(config.seasonsFrom(), config.seasonsTo());
    }

    /**
     * @param label Season label such as {@code "2022/2023"} or {@code "2023"}
     * @return true when the label's start year lies in the range
     */
    public boolean contains(String label) {
        if (label == null) return false;
        Matcher m = LABEL.matcher(label);
        if (!m.find()) return false;
        int start = Integer.parseInt(m.group(1));
        return start >= fromYear && start <= toYear;
    }
}
