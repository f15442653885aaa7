package com.rolefit.matcher.rank;

import java.util.List;

/**
 * Ranked candidates, best first, with the timing of the run.
 */
public record Ranking(List<RankedCandidate> candidates, RankingMetrics metrics) {

    public Ranking {
        candidates = List.copyOf(candidates);
    }
}
