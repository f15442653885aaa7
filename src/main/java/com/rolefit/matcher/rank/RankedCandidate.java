package com.rolefit.matcher.rank;

import com.rolefit.matcher.score.MatchResult;

/**
 * One row of a ranking.
 *
 * @param rank        1-based position
 * @param id          candidate identifier
 * @param result      the candidate's match result
 * @param matchReason opening of the candidate's best matching passage
 */
public record RankedCandidate(int rank, String id, MatchResult result, String matchReason) {

    public double compositeScore() {
        return result.compositeScore();
    }
}
