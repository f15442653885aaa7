package com.rolefit.matcher.explain;

import com.rolefit.matcher.score.Adjustment;
import com.rolefit.matcher.score.MatchCategory;
import com.rolefit.matcher.score.MatchEvidence;
import com.rolefit.matcher.score.MatchResult;
import com.rolefit.matcher.score.SubScores;
import com.rolefit.matcher.semantic.ChunkMatch;

import java.util.List;

/**
 * Structured summary of a match handed to an explanation provider.
 *
 * @param compositeScore  final score in [0, 1]
 * @param category        score band
 * @param subScores       the four sub-scores
 * @param adjustments     every adjustment, in application order
 * @param matchedSkills   canonical skills found on both sides
 * @param missingSkills   role skills the candidate lacks, required first
 * @param topPassages     candidate passages closest to the role, best first
 * @param roleText        the role document text
 */
public record ExplanationRequest(
    double compositeScore,
    MatchCategory category,
    SubScores subScores,
    List<Adjustment> adjustments,
    List<String> matchedSkills,
    List<String> missingSkills,
    List<String> topPassages,
    String roleText
) {

    public ExplanationRequest {
        adjustments = List.copyOf(adjustments);
        matchedSkills = List.copyOf(matchedSkills);
        missingSkills = List.copyOf(missingSkills);
        topPassages = List.copyOf(topPassages);
        roleText = roleText == null ? "" : roleText;
    }

    public static ExplanationRequest from(MatchResult result, String roleText) {
        if (result == null) {
            throw new IllegalArgumentException("Result cannot be null");
        }
        MatchEvidence evidence = result.breakdown().getEvidence();
        return new ExplanationRequest(
            result.compositeScore(),
            result.category(),
            result.breakdown().getSubScores(),
            result.breakdown().getAdjustments(),
            evidence.matchedSkills(),
            evidence.allMissingSkills(),
            passagesOf(evidence.topMatches()),
            roleText);
    }

    /**
     * Topmost passage, or empty when there are none.
     */
    public String bestPassage() {
        return topPassages.isEmpty() ? "" : topPassages.get(0);
    }

    private static List<String> passagesOf(List<ChunkMatch> matches) {
        return matches.stream().map(m -> m.chunk().text()).toList();
    }
}
