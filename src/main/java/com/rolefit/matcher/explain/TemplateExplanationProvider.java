package com.rolefit.matcher.explain;

import com.rolefit.matcher.score.Adjustment;
import com.rolefit.matcher.score.AdjustmentReason;

import java.util.ArrayList;
import java.util.List;

/**
 * Offline explanation built from the breakdown alone. Never fails.
 */
public class TemplateExplanationProvider implements ExplanationProvider {

    public static final String NAME = "template";

    private final ImprovementAdvisor advisor;

    public TemplateExplanationProvider() {
        this(new ImprovementAdvisor());
    }

    public TemplateExplanationProvider(ImprovementAdvisor advisor) {
        this.advisor = advisor;
    }

    @Override
    public Explanation explain(ExplanationRequest request) {
        String summary = String.format("This candidate has a %.1f%% match based on semantic analysis "
                + "and keyword matching. %s.",
            request.compositeScore() * 100, request.category().getRecommendation());

        List<String> strengths = new ArrayList<>();
        if (!request.matchedSkills().isEmpty()) {
            strengths.add("Matches " + request.matchedSkills().size() + " role skills: "
                + String.join(", ", head(request.matchedSkills(), 5)));
        }
        if (request.subScores().semantic() >= 0.5) {
            strengths.add(String.format("Experience reads close to the role (semantic %.2f)",
                request.subScores().semantic()));
        }
        request.adjustments().stream()
            .filter(a -> a.reason() == AdjustmentReason.CROSS_DOMAIN_BONUS)
            .findFirst()
            .ifPresent(a -> strengths.add("Transferable background despite limited keyword overlap"));
        if (strengths.isEmpty()) {
            strengths.add("Some relevant experience found");
        }

        List<String> gaps = new ArrayList<>();
        if (!request.missingSkills().isEmpty()) {
            gaps.add("Missing " + request.missingSkills().size() + " skills: "
                + String.join(", ", head(request.missingSkills(), 5)));
        }
        for (Adjustment a : request.adjustments()) {
            if (a.reason() == AdjustmentReason.MISSING_SKILL_PENALTY) {
                gaps.add(String.format("Keyword score reduced by %.2f: %s", -a.delta(), a.description()));
            }
        }
        if (request.subScores().experience() < 1.0) {
            gaps.add(String.format("Experience below the stated requirement (score %.2f)",
                request.subScores().experience()));
        }
        if (request.subScores().education() < 1.0) {
            gaps.add(String.format("Education below the stated requirement (score %.2f)",
                request.subScores().education()));
        }

        List<String> suggestions = advisor.suggest(request.matchedSkills(), request.missingSkills());
        return new Explanation(summary, head(strengths, 3), head(gaps, 3), suggestions, NAME);
    }

    private static List<String> head(List<String> items, int n) {
        return items.subList(0, Math.min(n, items.size()));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
