package com.sportsarchive.scraper;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {
    @TempDir
    Path outputDir;

    @Test
    void testCountryDirectoryIsPreparedOnce() throws Exception {
        StorageService storage = new StorageService();

        Path first = Main.prepareCountryDir(storage, outputDir, "Bosnia and Herzegovina");
        Path second = Main.prepareCountryDir(storage, outputDir, "Bosnia and Herzegovina");

        assertEquals(outputDir.resolve("Bosnia_and_Herzegovina"), first);
        assertEquals(first, second);
        assertEquals("Country = Bosnia and Herzegovina\n", Files.readString(first.resolve("metadata.txt")));
    }

    @Test
    void testComposerIsWiredForSession() {
        FakeTime time = new FakeTime();
        TournamentComposer composer = Main.composerFor(new FakeBrowserSession(), ScraperConfig.defaults(),
            new StorageService(), time, () -> true);

        assertNotNull(composer);
    }
}
