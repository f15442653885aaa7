package com.rolefit.matcher.explain;

import com.rolefit.matcher.score.MatchResult;
import com.rolefit.matcher.semantic.ProviderException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ExplanationServiceTest {

    private static final ExplanationProvider FAILING = new ExplanationProvider() {
        @Override
        public Explanation explain(ExplanationRequest request) {
            throw new ProviderException("upstream timeout");
        }

        @Override
        public String getName() {
            return "failing";
        }
    };

    @Test
    void shouldUsePrimaryProvider() {
        ExplanationService service = new ExplanationService(new TemplateExplanationProvider(), null);

        Optional<Explanation> explanation = service.explain(ExplanationFixtures.strongMatch(), "role");

        assertThat(explanation).hasValueSatisfying(e -> assertThat(e.source()).isEqualTo("template"));
    }

    @Test
    void shouldFallBackWhenPrimaryFails() {
        ExplanationService service = new ExplanationService(FAILING, new TemplateExplanationProvider());

        Optional<Explanation> explanation = service.explain(ExplanationFixtures.weakMatch(), "role");

        assertThat(explanation).hasValueSatisfying(e -> assertThat(e.source()).isEqualTo("template"));
    }

    @Test
    void shouldReturnEmptyWhenAllProvidersFail() {
        ExplanationService service = new ExplanationService(FAILING, null);

        assertThat(service.explain(ExplanationFixtures.weakMatch(), "role")).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenDisabled() {
        ExplanationService service = new ExplanationService(null, null);

        assertThat(service.explain(ExplanationFixtures.strongMatch(), "role")).isEmpty();
    }

    @Test
    void shouldNotChangeScore() {
        MatchResult result = ExplanationFixtures.weakMatch();
        double before = result.compositeScore();

        new ExplanationService(FAILING, new TemplateExplanationProvider()).explain(result, "role");

        assertThat(result.compositeScore()).isEqualTo(before);
        assertThat(result.breakdown().getAdjustments()).extracting(a -> a.reason().name())
            .isEqualTo(List.of("MISSING_SKILL_PENALTY", "CROSS_DOMAIN_BONUS"));
    }
}
