package com.sportsarchive.scraper;

import java.util.List;

/**
 * The three disjoint buckets a tournament crawl sorts its seasons into.
 */
public record TournamentOutcome(List<SeasonResult> composed, List<SeasonResult> repaired,
                                List<SeasonResult> erroneous) {
    public TournamentOutcome {
        composed = composed == null ? List.of() : List.copyOf(composed);
        repaired = repaired == null ? List.of() : List.copyOf(repaired);
        erroneous = erroneous == null ? List.of() : List.copyOf(erroneous);
    }

    public static TournamentOutcome empty() {
        return new TournamentOutcome(List.of(), List.of(), List.of());
    }

    public int seasonCount() {
        return composed.size() + repaired.size() + erroneous.size();
    }
}
