package com.sportsarchive.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class TournamentComposerTest {
    private static final String PAGE = "https://globalsportsarchive.com/competition/soccer/premier-league/";

    @TempDir
    Path countryDir;

    private FakeTime time;
    private StorageService storage;
    private ScraperConfig config;
    private SeasonDiscoveryResult discovered;
    private final Map<String, Deque<Object>> scripted = new HashMap<>();
    private final List<String> calls = new ArrayList<>();

    private final List<Gameweek> gameweeks = List.of(new Gameweek(1, List.of(
        new Match("2023-08-12", "15:00", "Alpha", "Beta", "1 - 0", "https://globalsportsarchive.com/match/1/", null))));
    private final List<StandingRow> table = List.of(new StandingRow("1", "Alpha", 1, 1, 0, 0, 1, 0, 1, 3));

    @BeforeEach
    void setUp() {
        time = new FakeTime();
        storage = new StorageService();
        Properties overrides = new Properties();
        overrides.setProperty("scraper.rescrape.maxCount", "2");
        overrides.setProperty("scraper.delay.seasonMs", "1000");
        config = ScraperConfig.withOverrides(overrides);
    }

    private SeasonLink season(String label, int id) {
        return new SeasonLink(label, "https://globalsportsarchive.com/competition/soccer/pl/" + id + "/", table);
    }

    private void script(SeasonLink link, Object... attempts) {
        scripted.put(link.url(), new ArrayDeque<>(List.of(attempts)));
    }

    private TournamentComposer composer() {
        SeasonDiscovery discovery = new SeasonDiscovery(null, null, null, null, storage, config, time) {
            @Override
            public SeasonDiscoveryResult discoverSeasons(String pageUrl, Path outputDir, boolean leaguesOnly) {
                return discovered;
            }
        };
        SeasonScraper scraper = new SeasonScraper(null, null, null, storage, config, time) {
            @Override
            public ScrapeOutcome scrapeSeason(String seasonUrl, Path outputDir, String uniqueFileId) {
                calls.add(outputDir.getFileName() + ":" + uniqueFileId);
                Object next = scripted.get(seasonUrl).poll();
                if (next instanceof RuntimeException e) throw e;
                return (ScrapeOutcome) next;
            }
        };
        return new TournamentComposer(discovery, scraper, storage, config, time, time);
    }

    @Test
    void testSeasonsAreBucketedAndPersisted() throws Exception {
        SeasonLink clean = season("2021/2022", 1);
        SeasonLink fixable = season("2022/2023", 2);
        SeasonLink broken = season("2023/2024", 3);
        discovered = new SeasonDiscoveryResult(SeasonDiscoveryResult.Status.FOUND, List.of(clean, fixable, broken));
        ScrapeOutcome partial = new ScrapeOutcome(true, gameweeks);
        script(clean, new ScrapeOutcome(false, gameweeks));
        script(fixable, ScrapeOutcome.failed(), new ScrapeOutcome(false, gameweeks));
        script(broken, partial, ScrapeOutcome.failed(), ScrapeOutcome.failed());

        TournamentOutcome outcome = composer().scrapeTournament("Premier League", PAGE, countryDir);

        assertEquals(List.of("2021/2022"), outcome.composed().stream().map(SeasonResult::season).toList());
        assertEquals(List.of("2022/2023"), outcome.repaired().stream().map(SeasonResult::season).toList());
        assertEquals(List.of("2023/2024"), outcome.erroneous().stream().map(SeasonResult::season).toList());
        assertEquals(gameweeks, outcome.erroneous().get(0).gameweeks());
        assertEquals(table, outcome.composed().get(0).leagueStanding());
        assertEquals(3, outcome.seasonCount());

        assertEquals(List.of("2021_2022:null", "2022_2023:null", "retries:1000", "2023_2024:null",
            "retries:2000", "retries:2000"), calls);
        assertEquals(List.of(1_000L, 1_000L), time.sleeps);

        Path dataDir = countryDir.resolve("Premier_League");
        TournamentResult composed = storage.readJson(dataDir.resolve("composed.json"),
            new TypeReference<TournamentResult>() {}).orElseThrow();
        assertEquals("Premier League", composed.tournament());
        assertEquals(1, composed.data().size());
        assertTrue(Files.exists(dataDir.resolve("repaired.json")));
        assertTrue(Files.exists(dataDir.resolve("erroneous.json")));
    }

    @Test
    void testEmptyBucketsAreNotWritten() throws Exception {
        SeasonLink clean = season("2021/2022", 1);
        discovered = new SeasonDiscoveryResult(SeasonDiscoveryResult.Status.FOUND, List.of(clean));
        script(clean, new ScrapeOutcome(false, gameweeks));

        TournamentOutcome outcome = composer().scrapeTournament("Premier League", PAGE, countryDir);

        Path dataDir = countryDir.resolve("Premier_League");
        assertEquals(1, outcome.composed().size());
        assertTrue(Files.exists(dataDir.resolve("composed.json")));
        assertFalse(Files.exists(dataDir.resolve("repaired.json")));
        assertFalse(Files.exists(dataDir.resolve("erroneous.json")));
        assertTrue(time.sleeps.isEmpty());
    }

    @Test
    void testReconnectionTimeoutMarksSeasonErroneous() throws Exception {
        SeasonLink lost = season("2022/2023", 2);
        SeasonLink next = season("2023/2024", 3);
        discovered = new SeasonDiscoveryResult(SeasonDiscoveryResult.Status.FOUND, List.of(lost, next));
        script(lost, new ReconnectionTimeoutException("Network reconnection timeout exceeded", null));
        script(next, new ScrapeOutcome(false, gameweeks));

        TournamentOutcome outcome = composer().scrapeTournament("Premier League", PAGE, countryDir);

        assertEquals(1, outcome.erroneous().size());
        assertTrue(outcome.erroneous().get(0).gameweeks().isEmpty());
        assertEquals(1, outcome.composed().size());
    }

    @Test
    void testNonLeagueTournamentProducesNothing() throws Exception {
        discovered = SeasonDiscoveryResult.of(SeasonDiscoveryResult.Status.NOT_A_LEAGUE);

        TournamentOutcome outcome = composer().scrapeTournament("Cup", PAGE, countryDir);

        assertEquals(0, outcome.seasonCount());
        assertTrue(calls.isEmpty());
        assertFalse(Files.exists(countryDir.resolve("Cup").resolve("composed.json")));
    }
}
