package com.rolefit.matcher.match;

/**
 * A sub-score computed from structured cues in the two documents.
 *
 * <p>Implementations fail soft: when nothing can be extracted from either side they return
 * {@link #NEUTRAL} instead of throwing.
 */
public interface AuxiliaryMatcher {

    double NEUTRAL = 1.0;

    /**
     * @return a score in [0, 1]
     */
    double score(String candidateText, String roleText);
}
