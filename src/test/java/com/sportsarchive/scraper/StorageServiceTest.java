package com.sportsarchive.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class StorageServiceTest {
    @TempDir
    Path dir;

    private final StorageService storage = new StorageService();

    @Test
    void testWriteJsonCreatesParentsAndUsesGameweekKey() throws Exception {
        Path file = dir.resolve("Spain/La_Liga/2022_2023/matches_1.json");
        Match match = new Match("2022-08-13", "19:00", "Osasuna", "Sevilla", "2 - 1", "https://x/1", null);

        storage.writeJson(file, List.of(new Gameweek(1, List.of(match))));

        String json = Files.readString(file);
        assertTrue(json.contains("\"gameweek\" : 1"));
        assertFalse(json.contains("awarded"));
        List<Gameweek> back = storage.readJson(file, new TypeReference<List<Gameweek>>() {}).orElseThrow();
        assertEquals(match, back.get(0).matches().get(0));
    }

    @Test
    void testAppendJsonSeparatesEntriesWithBlankLine() throws Exception {
        Path log = dir.resolve("issues.log");
        storage.appendJson(log, Issue.of("u", IssueType.WARNING, "first"));
        storage.appendJson(log, Issue.of("u", IssueType.ERROR, "second"));

        String content = Files.readString(log);
        assertEquals(2, content.split("\n\n").length);
        assertTrue(content.endsWith("}\n\n"));
        assertFalse(content.contains("gameweek"));
    }

    @Test
    void testReadMissingFileIsEmpty() throws Exception {
        Optional<List<Gameweek>> missing = storage.readJson(dir.resolve("none.json"),
            new TypeReference<List<Gameweek>>() {});
        assertTrue(missing.isEmpty());
        assertFalse(storage.exists(dir.resolve("none.json")));
    }

    @Test
    void testAppendTextAddsLines() throws Exception {
        Path metadata = dir.resolve("Italy/metadata.txt");
        storage.appendText(metadata, "Country = Italy");
        assertTrue(storage.exists(metadata));
        assertEquals("Country = Italy\n", Files.readString(metadata));
    }
}
