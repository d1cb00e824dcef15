package com.sportsarchive.scraper;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

public class SeasonRangeTest {
    private final SeasonRange range = new SeasonRange(2019, 2025);

    @Test
    void testStartYearIsInclusive() {
        assertTrue(range.contains("2019/2020"));
        assertTrue(range.contains("2025/2026"));
        assertTrue(range.contains("2023"));
    }

    @Test
    void testOutsideRangeOrUnlabelled() {
        assertFalse(range.contains("2018/2019"));
        assertFalse(range.contains("2026/2027"));
        assertFalse(range.contains("Current season"));
        assertFalse(range.contains(null));
    }

    @Test
    void testInvertedRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SeasonRange(2025, 2019));
    }
}
