package com.sportsarchive.scraper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts navigation order into chronological order.
 * <p>
 * Gameweeks without any validly dated match are dropped, as is any gameweek whose sorted signature list repeats an
 * earlier one. The rest are sorted by their earliest valid date (undated sorts last), matches inside a gameweek are
 * ordered by date the same way, and gameweeks are renumbered from 1. Both sorts are stable, so re-running the
 * sequencer on its own output changes nothing.
 */
public final class GameweekSequencer {
    private GameweekSequencer() {}

    static final String LATEST_DATE = "9999-12-31";

    private static final Comparator<Match> BY_DATE = Comparator.comparing(GameweekSequencer::sortKey);

    public static List<Gameweek> sortByDate(List<Gameweek> gameweeks) {
        List<Gameweek> unique = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Gameweek gw : gameweeks) {
            if (gw.matches().stream().noneMatch(Match::hasValidDate)) continue;
            String setSignature = String.join(";", gw.matches().stream().map(Match::signature).sorted().toList());
            if (seen.add(setSignature)) {
                unique.add(gw);
            }
        }

        List<Gameweek> sorted = new ArrayList<>(unique);
        sorted.sort(Comparator.comparing(GameweekSequencer::earliestDate));

        List<Gameweek> result = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            List<Match> matches = new ArrayList<>(sorted.get(i).matches());
            matches.sort(BY_DATE);
            result.add(new Gameweek(i + 1, matches));
        }
        return result;
    }

    static String earliestDate(Gameweek gw) {
        return gw.matches().stream()
            .filter(Match::hasValidDate)
            .map(Match::date)
            .min(String::compareTo)
            .orElse(LATEST_DATE);
    }

    private static String sortKey(Match match) {
        return match.hasValidDate() ? match.date() : LATEST_DATE;
    }
}
