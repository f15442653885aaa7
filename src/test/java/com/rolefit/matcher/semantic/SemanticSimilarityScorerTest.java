package com.rolefit.matcher.semantic;

import com.rolefit.matcher.document.Chunk;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SemanticSimilarityScorerTest {

    private final SemanticSimilarityScorer scorer = new SemanticSimilarityScorer();

    private static List<Chunk> chunks(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> new Chunk(i, "chunk " + i, i * 10, i * 10 + 7))
            .toList();
    }

    @Nested
    class RoleAggregationTests {

        @Test
        void shouldCompareCandidateChunksWithMeanOfRoleChunks() {
            // Given - role chunks (1,0) and (0,1) average to (0.5,0.5)
            List<float[]> roleVectors = List.of(new float[] {1, 0}, new float[] {0, 1});
            List<float[]> candidateVectors = List.of(new float[] {1, 0}, new float[] {1, 1});

            // When
            SemanticScore score = scorer.score(chunks(2), candidateVectors, roleVectors, 1.0, 5);

            // Then - chunk 1 is parallel to the mean, chunk 0 sits at 45 degrees
            assertThat(score.rawSimilarity()).isCloseTo(1.0, within(1e-6));
            assertThat(score.topMatches()).extracting(m -> m.chunk().index()).containsExactly(1, 0);
            assertThat(score.topMatches().get(1).similarity()).isCloseTo(Math.sqrt(0.5), within(1e-6));
        }

        @Test
        void shouldNotUseBestRoleChunkPair() {
            // Given - candidate equals one role chunk exactly but not the role mean
            List<float[]> roleVectors = List.of(new float[] {1, 0}, new float[] {0, 1});
            List<float[]> candidateVectors = List.<float[]>of(new float[] {1, 0});

            // When
            SemanticScore score = scorer.score(chunks(1), candidateVectors, roleVectors, 1.0, 5);

            // Then
            assertThat(score.rawSimilarity()).isCloseTo(Math.sqrt(0.5), within(1e-6));
        }

        @Test
        void shouldWrapInconsistentRoleDimensions() {
            assertThatThrownBy(() -> scorer.aggregateRole(List.of(new float[] {1, 0}, new float[] {1})))
                .isInstanceOf(ProviderException.class);
        }
    }

    @Nested
    class BoostTests {

        @Test
        void shouldMultiplyRawSimilarityByBoostFactor() {
            // Given - cosine 0.3 between (0.3, sqrt(0.91)) and (1, 0)
            List<float[]> roleVectors = List.<float[]>of(new float[] {1, 0});
            List<float[]> candidateVectors = List.<float[]>of(new float[] {0.3f, (float) Math.sqrt(0.91)});

            // When
            SemanticScore score = scorer.score(chunks(1), candidateVectors, roleVectors, 1.8, 5);

            // Then
            assertThat(score.rawSimilarity()).isCloseTo(0.3, within(1e-6));
            assertThat(score.score()).isCloseTo(0.54, within(1e-6));
            assertThat(score.boostDelta()).isCloseTo(0.24, within(1e-6));
        }

        @Test
        void shouldClampBoostedScoreToOne() {
            List<float[]> vectors = List.<float[]>of(new float[] {1, 1});

            SemanticScore score = scorer.score(chunks(1), vectors, vectors, 1.8, 5);

            assertThat(score.score()).isEqualTo(1.0);
        }

        @Test
        void shouldFloorNegativeSimilarityAtZero() {
            SemanticScore score = scorer.score(chunks(1),
                List.<float[]>of(new float[] {-1, 0}), List.<float[]>of(new float[] {1, 0}), 1.8, 5);

            assertThat(score.rawSimilarity()).isZero();
            assertThat(score.score()).isZero();
        }
    }

    @Nested
    class TopMatchTests {

        @Test
        void shouldBreakTiesByEarlierChunk() {
            // Given - chunks 0, 2 and 3 are identical
            float[] same = {1, 0};
            List<float[]> candidateVectors = List.of(same, new float[] {1, 1}, same, same);

            // When
            SemanticScore score = scorer.score(chunks(4), candidateVectors, List.of(same), 1.0, 3);

            // Then
            assertThat(score.topMatches()).extracting(m -> m.chunk().index()).containsExactly(0, 2, 3);
        }

        @Test
        void shouldLimitTopMatches() {
            List<float[]> vectors = List.of(new float[] {1, 0}, new float[] {1, 0}, new float[] {1, 0});

            SemanticScore score = scorer.score(chunks(3), vectors, List.<float[]>of(new float[] {1, 0}), 1.8, 2);

            assertThat(score.topMatches()).hasSize(2);
        }
    }

    @Test
    void shouldReturnZeroForEmptyCandidate() {
        SemanticScore score = scorer.score(List.of(), List.of(), List.<float[]>of(new float[] {1}), 1.8, 5);

        assertThat(score.score()).isZero();
        assertThat(score.topMatches()).isEmpty();
    }

    @Test
    void shouldRejectDimensionMismatchBetweenCandidateAndRole() {
        assertThatThrownBy(() -> scorer.score(chunks(1),
            List.<float[]>of(new float[] {1, 0, 0}), List.<float[]>of(new float[] {1, 0}), 1.8, 5))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("dimension");
    }

    @Test
    void shouldRejectVectorCountMismatch() {
        assertThatThrownBy(() -> scorer.score(chunks(2),
            List.<float[]>of(new float[] {1, 0}), List.<float[]>of(new float[] {1, 0}), 1.8, 5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
