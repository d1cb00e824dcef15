package com.sportsarchive.scraper;

import org.junit.jupiter.api.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GameweekSequencerTest {
    private static Match match(String home, String away, String date) {
        return new Match(date, "15:00", home, away, "1 - 0", "https://example.org/m/" + home + away, null);
    }

    @Test
    void testDropsEmptyGameweekAndOrdersByEarliestDate() {
        Match a = match("Arsenal", "Chelsea", "2022-08-13");
        Match b = match("Everton", "Fulham", "2022-08-01");
        Match c = match("Leeds", "Wolves", "2022-07-25");
        List<Gameweek> input = List.of(
            new Gameweek(1, List.of(a)),
            new Gameweek(2, List.of()),
            new Gameweek(3, List.of(b, c)));

        List<Gameweek> sorted = GameweekSequencer.sortByDate(input);

        assertEquals(2, sorted.size());
        assertEquals(1, sorted.get(0).number());
        assertEquals(List.of(c, b), sorted.get(0).matches());
        assertEquals(2, sorted.get(1).number());
        assertEquals(List.of(a), sorted.get(1).matches());
    }

    @Test
    void testIsIdempotent() {
        List<Gameweek> input = List.of(
            new Gameweek(4, List.of(match("A", "B", "2023-03-04"), match("C", "D", "TBD"))),
            new Gameweek(1, List.of(match("E", "F", "2023-01-10"))),
            new Gameweek(7, List.of(match("G", "H", "2023-02-01"), match("I", "J", "2023-01-31"))));

        List<Gameweek> once = GameweekSequencer.sortByDate(input);
        List<Gameweek> twice = GameweekSequencer.sortByDate(once);

        assertEquals(once, twice);
    }

    @Test
    void testRemovesGameweekCapturedTwice() {
        Match x = match("Porto", "Benfica", "2021-10-02");
        Match y = match("Braga", "Sporting", "2021-10-03");
        List<Gameweek> input = List.of(
            new Gameweek(1, List.of(x, y)),
            new Gameweek(2, List.of(y, x)),
            new Gameweek(3, List.of(match("Boavista", "Tondela", "2021-10-20"))));

        List<Gameweek> sorted = GameweekSequencer.sortByDate(input);

        assertEquals(2, sorted.size());
        assertEquals(List.of(x, y), sorted.get(0).matches());
    }

    @Test
    void testDropsGameweeksWithoutAnyValidDate() {
        List<Gameweek> input = List.of(
            new Gameweek(1, List.of(match("A", "B", "Postponed"))),
            new Gameweek(2, List.of(match("C", "D", "2020-09-12"))));

        List<Gameweek> sorted = GameweekSequencer.sortByDate(input);

        assertEquals(1, sorted.size());
        assertEquals("C", sorted.get(0).matches().get(0).homeTeam());
    }

    @Test
    void testNumbersAreContiguousAndSignaturesDistinct() {
        List<Gameweek> input = List.of(
            new Gameweek(9, List.of(match("A", "B", "2024-05-01"))),
            new Gameweek(3, List.of(match("C", "D", "2024-03-01"))),
            new Gameweek(5, List.of(match("E", "F", "2024-04-01"))));

        List<Gameweek> sorted = GameweekSequencer.sortByDate(input);

        Set<String> signatures = new HashSet<>();
        for (int i = 0; i < sorted.size(); i++) {
            assertEquals(i + 1, sorted.get(i).number());
            sorted.get(i).matches().forEach(m -> assertTrue(signatures.add(m.signature())));
        }
        assertEquals("2024-03-01", GameweekSequencer.earliestDate(sorted.get(0)));
    }
}
