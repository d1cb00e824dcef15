package com.sportsarchive.scraper;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {
    @Test
    void testNormalizeFilepath() {
        assertEquals("2022_2023", Utils.normalizeFilepath("2022/2023"));
        assertEquals("Bosnia_and_Herzegovina", Utils.normalizeFilepath("Bosnia and Herzegovina"));
        assertEquals("Premier_League__2_", Utils.normalizeFilepath("Premier League: 2$"));
        assertEquals("", Utils.normalizeFilepath(null));
    }

    @Test
    void testSeasonIdFromUrl() {
        assertEquals("123", Utils.seasonIdFromUrl("https://host/soccer/competition/league-2022-2023/123/"));
        assertEquals("league", Utils.seasonIdFromUrl("https://host/league/123"));
        assertEquals("", Utils.seasonIdFromUrl("nothing"));
    }

    @Test
    void testAbsoluteUrl() {
        String base = "https://globalsportsarchive.com";
        assertEquals("https://cdn.example.org/a", Utils.absoluteUrl(base, "//cdn.example.org/a"));
        assertEquals(base + "/match/1/", Utils.absoluteUrl(base, "/match/1/"));
        assertEquals(base + "/match/1/", Utils.absoluteUrl(base + "/", "/match/1/"));
        assertEquals(base + "/match/1/", Utils.absoluteUrl(base, "match/1/"));
        assertEquals("http://other.org/x", Utils.absoluteUrl(base, "http://other.org/x"));
    }

    @Test
    void testPolitePauseStaysWithinJitter() throws InterruptedException {
        FakeTime time = new FakeTime();
        Utils.politePause(time, 3_000, 2_000);
        Utils.politePause(time, 5_000, 0);
        assertTrue(time.sleeps.get(0) >= 3_000 && time.sleeps.get(0) < 5_000);
        assertEquals(5_000L, time.sleeps.get(1));
    }
}
