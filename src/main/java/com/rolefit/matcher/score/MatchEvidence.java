package com.rolefit.matcher.score;

import com.rolefit.matcher.semantic.ChunkMatch;

import java.util.List;
import java.util.stream.Stream;

/**
 * The literal findings behind the sub-scores: which skills matched or were missing, and
 * which candidate passages were closest to the role.
 */
public record MatchEvidence(
    List<String> matchedSkills,
    List<String> missingRequiredSkills,
    List<String> missingPreferredSkills,
    List<ChunkMatch> topMatches
) {

    public static final MatchEvidence EMPTY = new MatchEvidence(List.of(), List.of(), List.of(), List.of());

    public MatchEvidence {
        matchedSkills = List.copyOf(matchedSkills);
        missingRequiredSkills = List.copyOf(missingRequiredSkills);
        missingPreferredSkills = List.copyOf(missingPreferredSkills);
        topMatches = List.copyOf(topMatches);
    }

    /**
     * Required and preferred skills the candidate lacks, required first.
     */
    public List<String> allMissingSkills() {
        return Stream.concat(missingRequiredSkills.stream(), missingPreferredSkills.stream())
            .toList();
    }
}
