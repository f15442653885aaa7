package com.rolefit.matcher.semantic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider(64);

    @Test
    void shouldReturnOneVectorPerTextInOrder() {
        List<float[]> vectors = provider.embed(List.of("python spark", "kubernetes", "python spark"));

        assertThat(vectors).hasSize(3);
        assertThat(vectors).allSatisfy(v -> assertThat(v).hasSize(64));
        assertThat(vectors.get(0)).containsExactly(vectors.get(2));
    }

    @Test
    void shouldBeDeterministicAcrossInstances() {
        float[] first = provider.embed(List.of("Built data pipelines with Airflow")).get(0);
        float[] second = new HashingEmbeddingProvider(64).embed(List.of("Built data pipelines with Airflow")).get(0);

        assertThat(first).containsExactly(second);
    }

    @Test
    void shouldProduceUnitVectors() {
        float[] v = provider.embed(List.of("Senior data engineer with streaming experience")).get(0);

        double norm = 0.0;
        for (float x : v) {
            norm += x * x;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void shouldReturnZeroVectorForTextWithoutWords() {
        float[] v = provider.embed(List.of("... --- !!!")).get(0);

        assertThat(v).containsOnly(0f);
    }

    @Test
    void shouldRankLexicalOverlapAboveUnrelatedText() {
        List<float[]> v = provider.embed(List.of(
            "python data pipelines on spark",
            "spark data pipelines in python",
            "watercolour painting classes for children"));

        assertThat(VectorMath.cosine(v.get(0), v.get(1))).isGreaterThan(VectorMath.cosine(v.get(0), v.get(2)));
    }

    @Test
    void shouldNameModelByDimension() {
        assertThat(provider.getModel()).isEqualTo("hashing-64");
    }

    @Test
    void shouldRejectNonPositiveDimension() {
        assertThatThrownBy(() -> new HashingEmbeddingProvider(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
