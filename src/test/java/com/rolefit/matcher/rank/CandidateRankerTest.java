package com.rolefit.matcher.rank;

import com.rolefit.matcher.config.ComponentWeights;
import com.rolefit.matcher.config.ConfigException;
import com.rolefit.matcher.config.ScoringConfig;
import com.rolefit.matcher.document.Chunk;
import com.rolefit.matcher.document.Document;
import com.rolefit.matcher.document.EmptyInputException;
import com.rolefit.matcher.score.HybridMatchingEngine;
import com.rolefit.matcher.score.HybridScoreCombiner;
import com.rolefit.matcher.score.MatchEvidence;
import com.rolefit.matcher.score.MatchResult;
import com.rolefit.matcher.score.SubScores;
import com.rolefit.matcher.semantic.ChunkMatch;
import com.rolefit.matcher.semantic.EmbeddingProvider;
import com.rolefit.matcher.semantic.HashingEmbeddingProvider;
import com.rolefit.matcher.semantic.ProviderException;
import com.rolefit.matcher.skill.SkillVocabulary;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateRankerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
    private static final SkillVocabulary VOCABULARY = SkillVocabulary.loadDefault();

    private final CandidateRanker ranker =
        new CandidateRanker(new HybridMatchingEngine(new HashingEmbeddingProvider(), VOCABULARY, CLOCK));

    private static String fixture(String name) throws IOException {
        try (InputStream in = CandidateRankerTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    class OrderingTests {

        @Test
        void shouldOrderByCompositeScoreDescending() throws IOException {
            // Given
            List<CandidateEntry> candidates = List.of(
                CandidateEntry.of("changer.txt", fixture("candidate-career-changer.txt")),
                CandidateEntry.of("engineer.txt", fixture("candidate-data-engineer.txt")));

            // When
            Ranking ranking = ranker.rank(candidates, Document.targetRole(fixture("role-data-engineer.txt")),
                ScoringConfig.defaults(), VOCABULARY, 10);

            // Then
            assertThat(ranking.candidates()).extracting(RankedCandidate::id)
                .containsExactly("engineer.txt", "changer.txt");
            assertThat(ranking.candidates()).extracting(RankedCandidate::rank).containsExactly(1, 2);
            assertThat(ranking.candidates().get(0).compositeScore())
                .isGreaterThan(ranking.candidates().get(1).compositeScore());
        }

        @Test
        void shouldKeepInputOrderForEqualScores() throws IOException {
            String text = fixture("candidate-career-changer.txt");
            List<CandidateEntry> candidates = List.of(
                CandidateEntry.of("first", text),
                CandidateEntry.of("second", text),
                CandidateEntry.of("third", text));

            Ranking ranking = ranker.rank(candidates, Document.targetRole(fixture("role-data-engineer.txt")),
                ScoringConfig.defaults(), VOCABULARY, 10);

            assertThat(ranking.candidates()).extracting(RankedCandidate::id)
                .containsExactly("first", "second", "third");
        }

        @Test
        void shouldLimitToTopN() throws IOException {
            String text = fixture("candidate-data-engineer.txt");
            List<CandidateEntry> candidates = List.of(
                CandidateEntry.of("a", text), CandidateEntry.of("b", text), CandidateEntry.of("c", text));

            Ranking ranking = ranker.rank(candidates, Document.targetRole(fixture("role-data-engineer.txt")),
                ScoringConfig.defaults(), VOCABULARY, 2);

            assertThat(ranking.candidates()).hasSize(2);
            assertThat(ranking.metrics().getScored()).isEqualTo(3);
        }
    }

    @Nested
    class FailureTests {

        @Test
        void shouldSkipBlankCandidate() {
            List<CandidateEntry> candidates = List.of(
                CandidateEntry.of("blank", "   "),
                CandidateEntry.of("python", "Python developer with SQL"));

            Ranking ranking = ranker.rank(candidates, Document.targetRole("Python and SQL"),
                ScoringConfig.defaults(), VOCABULARY, 10);

            assertThat(ranking.candidates()).extracting(RankedCandidate::id).containsExactly("python");
            assertThat(ranking.metrics().getSkipped()).isEqualTo(1);
        }

        @Test
        void shouldSkipCandidateWhenProviderFails() {
            // Given - provider refuses any batch containing the marker word
            EmbeddingProvider flaky = new EmbeddingProvider() {
                private final HashingEmbeddingProvider delegate = new HashingEmbeddingProvider();

                @Override
                public List<float[]> embed(List<String> texts) {
                    if (texts.stream().anyMatch(t -> t.contains("unembeddable"))) {
                        throw new ProviderException("rejected input");
                    }
                    return delegate.embed(texts);
                }

                @Override
                public String getModel() {
                    return "flaky";
                }
            };
            CandidateRanker flakyRanker = new CandidateRanker(new HybridMatchingEngine(flaky, VOCABULARY, CLOCK));

            // When
            Ranking ranking = flakyRanker.rank(List.of(
                    CandidateEntry.of("bad", "an unembeddable resume"),
                    CandidateEntry.of("good", "Java engineer")),
                Document.targetRole("Java"), ScoringConfig.defaults(), VOCABULARY, 10);

            // Then
            assertThat(ranking.candidates()).extracting(RankedCandidate::id).containsExactly("good");
            assertThat(ranking.metrics().getSkipped()).isEqualTo(1);
        }

        @Test
        void shouldAbortOnInvalidConfig() {
            ScoringConfig config = ScoringConfig.defaults();
            config.setComponentWeights(new ComponentWeights(0.5, 0.5, 0.5, 0.5));

            assertThatThrownBy(() -> ranker.rank(List.of(CandidateEntry.of("a", "Python")),
                Document.targetRole("Python"), config, VOCABULARY, 10))
                .isInstanceOf(ConfigException.class);
        }

        @Test
        void shouldAbortOnBlankRole() {
            assertThatThrownBy(() -> ranker.rank(List.of(CandidateEntry.of("a", "Python")),
                Document.targetRole(" "), ScoringConfig.defaults(), VOCABULARY, 10))
                .isInstanceOf(EmptyInputException.class);
        }

        @Test
        void shouldRejectRoleDocumentAsCandidate() {
            assertThatThrownBy(() -> new CandidateEntry("a", Document.targetRole("Python")))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldTruncateMatchReason() {
        // Given
        String longChunk = "word ".repeat(100).strip();
        MatchEvidence evidence = new MatchEvidence(List.of(), List.of(), List.of(),
            List.of(new ChunkMatch(new Chunk(0, longChunk, 0, longChunk.length()), 0.7)));
        MatchResult result = MatchResult.of(new HybridScoreCombiner(ScoringConfig.defaults())
            .combine(new SubScores(0.5, 0.5, 0.5, 0.5), List.of(), evidence));

        // When
        String reason = CandidateRanker.matchReason(result);

        // Then
        assertThat(reason).hasSize(CandidateRanker.MATCH_REASON_LENGTH);
        assertThat(longChunk).startsWith(reason);
    }
}
