package com.rolefit.matcher.skill;

import com.rolefit.matcher.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;

/**
 * Scores literal skill overlap between a candidate and a role.
 *
 * <pre>
 * raw     = 0.8 * requiredMatched / requiredTotal + 0.2 * preferredMatched / preferredTotal
 * score   = max(0, raw - penaltyAmount)   when missingRequired >= penaltyThreshold
 *         = raw                           otherwise
 * </pre>
 * A ratio whose denominator is zero counts as 1.0.
 */
public class KeywordMatcher {

    private static final Logger log = LoggerFactory.getLogger(KeywordMatcher.class);

    static final double REQUIRED_SHARE = 0.8;
    static final double PREFERRED_SHARE = 0.2;

    private final SkillExtractor extractor;

    public KeywordMatcher() {
        this(new SkillExtractor());
    }

    public KeywordMatcher(SkillExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Match with default penalty settings.
     */
    public KeywordMatchResult match(String candidateText, String roleText, SkillVocabulary vocabulary) {
        return match(candidateText, roleText, vocabulary, ScoringConfig.defaults());
    }

    public KeywordMatchResult match(String candidateText, String roleText, SkillVocabulary vocabulary,
                                    ScoringConfig config) {
        if (candidateText == null || roleText == null) {
            throw new IllegalArgumentException("Document text cannot be null");
        }
        SkillSet candidate = extractor.extract(candidateText, vocabulary);
        SkillSet role = extractor.extract(roleText, vocabulary);
        return match(candidate, role, config);
    }

    /**
     * Match already-extracted skill sets. Only the role side's tiers matter; every
     * candidate skill counts regardless of where it was found.
     */
    public KeywordMatchResult match(SkillSet candidate, SkillSet role, ScoringConfig config) {
        if (candidate == null || role == null) {
            throw new IllegalArgumentException("Skill sets cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }

        Set<String> have = candidate.all();

        Set<String> matchedRequired = intersect(role.getRequired(), have);
        Set<String> matchedPreferred = intersect(role.getPreferred(), have);
        Set<String> missingRequired = subtract(role.getRequired(), have);
        Set<String> missingPreferred = subtract(role.getPreferred(), have);

        double requiredRatio = ratio(matchedRequired.size(), role.getRequired().size());
        double preferredRatio = ratio(matchedPreferred.size(), role.getPreferred().size());
        double raw = REQUIRED_SHARE * requiredRatio + PREFERRED_SHARE * preferredRatio;

        double score = raw;
        if (missingRequired.size() >= config.getMissingSkillPenaltyThreshold()) {
            score = Math.max(0.0, raw - config.getMissingSkillPenaltyAmount());
            log.debug("Missing-skill penalty applied: {} required skills missing (threshold {})",
                      missingRequired.size(), config.getMissingSkillPenaltyThreshold());
        }

        Set<String> matched = new TreeSet<>(matchedRequired);
        matched.addAll(matchedPreferred);

        KeywordMatchResult result = new KeywordMatchResult(matched, missingRequired, missingPreferred,
            role.getRequired().size(), role.getPreferred().size(), raw, score - raw, score);
        log.debug("Keyword match: {}", result);
        return result;
    }

    private static double ratio(int matched, int total) {
        return total == 0 ? 1.0 : (double) matched / total;
    }

    private static Set<String> intersect(Set<String> a, Set<String> b) {
        Set<String> out = new TreeSet<>(a);
        out.retainAll(b);
        return out;
    }

    private static Set<String> subtract(Set<String> a, Set<String> b) {
        Set<String> out = new TreeSet<>(a);
        out.removeAll(b);
        return out;
    }
}
