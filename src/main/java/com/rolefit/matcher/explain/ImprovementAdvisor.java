package com.rolefit.matcher.explain;

import com.rolefit.matcher.score.MatchEvidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Deterministic resume-improvement suggestions derived from the skill evidence.
 */
public class ImprovementAdvisor {

    static final int MAX_LISTED_SKILLS = 5;
    static final int THIN_SKILLS_SECTION = 5;

    private static final Set<String> CLOUD_PLATFORMS = Set.of("aws", "azure", "gcp");

    public List<String> suggest(MatchEvidence evidence) {
        return suggest(evidence.matchedSkills(), evidence.missingRequiredSkills());
    }

    public List<String> suggest(List<String> matchedSkills, List<String> missingSkills) {
        List<String> suggestions = new ArrayList<>();

        if (!missingSkills.isEmpty()) {
            List<String> top = missingSkills.subList(0, Math.min(MAX_LISTED_SKILLS, missingSkills.size()));
            suggestions.add("Add these key skills to your resume: " + String.join(", ", top));
        }
        if (matchedSkills.size() < THIN_SKILLS_SECTION) {
            suggestions.add("Expand your technical skills section with more specific tools and frameworks");
        }
        if (missingSkills.stream().anyMatch(CLOUD_PLATFORMS::contains)) {
            suggestions.add("Consider getting cloud platform experience (AWS/Azure/GCP)");
        }
        if (suggestions.isEmpty()) {
            suggestions.add("Strong skill match! Consider highlighting achievements and impact in your experience");
        }
        return suggestions;
    }
}
