package com.rolefit.matcher.explain;

import com.rolefit.matcher.score.MatchCategory;
import com.rolefit.matcher.score.SubScores;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateExplanationProviderTest {

    private final TemplateExplanationProvider provider = new TemplateExplanationProvider();

    @Test
    void shouldSummariseStrongMatch() {
        // When
        Explanation explanation = provider.explain(
            ExplanationRequest.from(ExplanationFixtures.strongMatch(), ExplanationFixtures.ROLE_TEXT));

        // Then
        assertThat(explanation.source()).isEqualTo("template");
        assertThat(explanation.summary())
            .startsWith("This candidate has a 97.2% match")
            .endsWith("Strong candidate - Recommend immediate interview.");
        assertThat(explanation.strengths()).hasSize(2);
        assertThat(explanation.strengths().get(0)).startsWith("Matches 6 role skills: airflow, aws, docker, python, spark");
        assertThat(explanation.gaps()).containsExactly("Missing 1 skills: kafka");
    }

    @Test
    void shouldDescribeGapsOfWeakMatch() {
        // When
        Explanation explanation = provider.explain(
            ExplanationRequest.from(ExplanationFixtures.weakMatch(), ExplanationFixtures.ROLE_TEXT));

        // Then - at most three gaps, missing skills first
        assertThat(explanation.gaps()).hasSize(3);
        assertThat(explanation.gaps().get(0)).isEqualTo("Missing 5 skills: aws, python, spark, sql, docker");
        assertThat(explanation.strengths())
            .contains("Transferable background despite limited keyword overlap");
        assertThat(explanation.suggestions())
            .contains("Consider getting cloud platform experience (AWS/Azure/GCP)");
    }

    @Test
    void shouldFallBackToGenericStrength() {
        ExplanationRequest request = new ExplanationRequest(0.2, MatchCategory.LOW, new SubScores(0.0, 0.1, 1.0, 1.0),
            List.of(), List.of(), List.of(), List.of(), "");

        Explanation explanation = provider.explain(request);

        assertThat(explanation.strengths()).containsExactly("Some relevant experience found");
        assertThat(explanation.gaps()).isEmpty();
    }
}
