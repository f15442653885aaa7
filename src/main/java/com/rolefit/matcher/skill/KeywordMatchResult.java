package com.rolefit.matcher.skill;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of comparing candidate skills against role skills.
 *
 * <p>{@code keywordScore} is {@code rawScore + penalty} where {@code penalty} is zero or
 * negative. Skill sets are sorted and unmodifiable.
 */
public final class KeywordMatchResult {

    private final Set<String> matched;
    private final Set<String> missingRequired;
    private final Set<String> missingPreferred;
    private final int requiredTotal;
    private final int preferredTotal;
    private final double rawScore;
    private final double penalty;
    private final double keywordScore;

    public KeywordMatchResult(Set<String> matched, Set<String> missingRequired, Set<String> missingPreferred,
                              int requiredTotal, int preferredTotal,
                              double rawScore, double penalty, double keywordScore) {
        this.matched = Collections.unmodifiableSet(new TreeSet<>(matched));
        this.missingRequired = Collections.unmodifiableSet(new TreeSet<>(missingRequired));
        this.missingPreferred = Collections.unmodifiableSet(new TreeSet<>(missingPreferred));
        this.requiredTotal = requiredTotal;
        this.preferredTotal = preferredTotal;
        this.rawScore = rawScore;
        this.penalty = penalty;
        this.keywordScore = keywordScore;
    }

    public Set<String> getMatched() {
        return matched;
    }

    public Set<String> getMissingRequired() {
        return missingRequired;
    }

    public Set<String> getMissingPreferred() {
        return missingPreferred;
    }

    public int getRequiredTotal() {
        return requiredTotal;
    }

    public int getPreferredTotal() {
        return preferredTotal;
    }

    /**
     * Weighted ratio before the missing-skill penalty.
     */
    public double getRawScore() {
        return rawScore;
    }

    /**
     * Signed change applied by the missing-skill penalty; 0.0 when not triggered.
     */
    public double getPenalty() {
        return penalty;
    }

    public boolean isPenaltyApplied() {
        return penalty != 0.0;
    }

    public double getKeywordScore() {
        return keywordScore;
    }

    @Override
    public String toString() {
        return String.format("KeywordMatchResult{matched=%s, missingRequired=%s, missingPreferred=%s, "
                + "raw=%.4f, penalty=%.4f, score=%.4f}",
            matched, missingRequired, missingPreferred, rawScore, penalty, keywordScore);
    }
}
