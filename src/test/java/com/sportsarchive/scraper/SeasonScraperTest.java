package com.sportsarchive.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SeasonScraperTest {
    private static final String SEASON_URL = "https://globalsportsarchive.com/competition/soccer/league-2023-2024/100/";

    @TempDir
    Path dir;

    private FakeTime time;
    private FakeBrowserSession session;
    private FakeSeasonPage page;
    private StorageService storage;
    private SeasonScraper scraper;

    @BeforeEach
    void setUp() {
        time = new FakeTime();
        session = new FakeBrowserSession();
        page = new FakeSeasonPage();
        storage = new StorageService();
        ScraperConfig config = ScraperConfig.defaults();
        RetryOrchestrator retry = new RetryOrchestrator(3, 2, 5_000L, 600_000L, time, () -> true, time);
        scraper = new SeasonScraper(session, retry, new StabilizationWait(time, time, 500), storage, config, time);
    }

    private static List<Map<String, Object>> week(String date, String... teams) {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(FakeSeasonPage.date(date));
        for (int i = 0; i + 1 < teams.length; i += 2) {
            rows.add(FakeSeasonPage.match(teams[i], teams[i + 1], "2 - 1"));
        }
        return rows;
    }

    @Test
    void testSeasonIsCrawledSequencedAndSaved() throws Exception {
        page.week(1, week("26 August 2023", "Alpha", "Beta", "Gamma", "Delta"))
            .week(2, week("12 August 2023", "Beta", "Gamma", "Delta", "Alpha"))
            .week(3, week("2 September 2023", "Alpha", "Gamma", "Beta", "Delta"));
        page.install(session);

        ScrapeOutcome outcome = scraper.scrapeSeason(SEASON_URL, dir, null);

        assertFalse(outcome.hasErrorOccurred());
        assertEquals(List.of(SEASON_URL), session.navigations);
        List<Gameweek> result = outcome.result();
        assertEquals(3, result.size());
        assertEquals(List.of(1, 2, 3), result.stream().map(Gameweek::number).toList());
        assertEquals("2023-08-12", result.get(0).matches().get(0).date());
        assertEquals("2023-08-26", result.get(1).matches().get(0).date());
        assertEquals("2023-09-02", result.get(2).matches().get(0).date());

        Path file = dir.resolve("matches_100.json");
        List<Gameweek> saved = storage.readJson(file, new TypeReference<List<Gameweek>>() {}).orElseThrow();
        assertEquals(result, saved);
        assertTrue(Files.readString(file).contains("\"gameweek\" : 1"));
        assertFalse(Files.exists(dir.resolve("gameweek_scrape_issues.log")));
    }

    @Test
    void testSeasonWithoutResultsIsCleanAndEmpty() throws Exception {
        page.week(1, week("26 August 2023", "Alpha", "Beta"));
        page.hasResults = false;
        page.install(session);

        ScrapeOutcome outcome = scraper.scrapeSeason(SEASON_URL, dir, null);

        assertFalse(outcome.hasErrorOccurred());
        assertTrue(outcome.result().isEmpty());
        assertFalse(Files.exists(dir.resolve("matches_100.json")));
    }

    @Test
    void testSkippedGameweekRaisesErrorFlagAndUsesFileId() throws Exception {
        List<Map<String, Object>> broken = week("19 August 2023", "Gamma", "Delta");
        broken.get(1).put("homeTeam", "");
        page.week(1, week("12 August 2023", "Alpha", "Beta", "Gamma", "Delta"))
            .week(2, broken)
            .week(3, week("26 August 2023", "Beta", "Alpha", "Delta", "Gamma"));
        page.install(session);

        ScrapeOutcome outcome = scraper.scrapeSeason(SEASON_URL, dir, "1700000000000");

        assertTrue(outcome.hasErrorOccurred());
        assertEquals(2, outcome.result().size());
        assertTrue(Files.exists(dir.resolve("matches_100.1700000000000.json")));
        String log = Files.readString(dir.resolve("gameweek_scrape_issues.1700000000000.log"));
        assertTrue(log.contains("Failed to scrape gameweek 2"));
    }

    @Test
    void testPageFailureGivesFailedOutcome() throws Exception {
        session.navigationFailures.add(new IllegalStateException("Target closed"));

        ScrapeOutcome outcome = scraper.scrapeSeason(SEASON_URL, dir, null);

        assertTrue(outcome.hasErrorOccurred());
        assertTrue(outcome.result().isEmpty());
        assertTrue(Files.readString(dir.resolve("gameweek_scrape_issues.log")).contains("Target closed"));
    }
}
