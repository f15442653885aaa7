package com.rolefit.matcher.explain;

import java.util.List;

/**
 * Narrative explanation of a match.
 *
 * @param summary     a few sentences on why the candidate does or does not fit
 * @param strengths   short strength statements
 * @param gaps        short gap statements
 * @param suggestions actionable suggestions
 * @param source      name of the provider that produced it
 */
public record Explanation(String summary, List<String> strengths, List<String> gaps,
                          List<String> suggestions, String source) {

    public Explanation {
        summary = summary == null ? "" : summary;
        strengths = List.copyOf(strengths);
        gaps = List.copyOf(gaps);
        suggestions = List.copyOf(suggestions);
    }
}
