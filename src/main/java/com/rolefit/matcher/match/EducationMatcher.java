package com.rolefit.matcher.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Compares the education level a role asks for with the candidate's highest level.
 *
 * <p>The role requirement is the lowest level the role mentions ("Bachelor's or Master's"
 * requires a bachelor's). Meeting or exceeding it scores 1.0, one tier below earns the
 * configured partial credit, anything lower scores 0.0. When either side states no level
 * the score is the neutral 1.0.
 */
public class EducationMatcher implements AuxiliaryMatcher {

    private static final Logger log = LoggerFactory.getLogger(EducationMatcher.class);

    private final double partialCredit;

    public EducationMatcher(double partialCredit) {
        if (Double.isNaN(partialCredit) || partialCredit < 0.0 || partialCredit > 1.0) {
            throw new IllegalArgumentException("Partial credit must be between 0.0 and 1.0, got " + partialCredit);
        }
        this.partialCredit = partialCredit;
    }

    @Override
    public double score(String candidateText, String roleText) {
        if (candidateText == null || roleText == null) {
            return NEUTRAL;
        }

        Optional<EducationLevel> required = lowestMentioned(roleText);
        Optional<EducationLevel> actual = highestMentioned(candidateText);
        if (required.isEmpty() || actual.isEmpty()) {
            log.debug("Education signal unavailable (required={}, candidate={}), using neutral score",
                      required.orElse(null), actual.orElse(null));
            return NEUTRAL;
        }

        int gap = actual.get().tiersBelow(required.get());
        double score;
        if (gap <= 0) {
            score = 1.0;
        } else if (gap == 1) {
            score = partialCredit;
        } else {
            score = 0.0;
        }
        log.debug("Education: required={}, candidate={}, score={}", required.get(), actual.get(), score);
        return score;
    }

    public Optional<EducationLevel> lowestMentioned(String text) {
        for (EducationLevel level : EducationLevel.values()) {
            if (level.foundIn(text)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    public Optional<EducationLevel> highestMentioned(String text) {
        EducationLevel[] levels = EducationLevel.values();
        for (int i = levels.length - 1; i >= 0; i--) {
            if (levels[i].foundIn(text)) {
                return Optional.of(levels[i]);
            }
        }
        return Optional.empty();
    }
}
