package com.rolefit.matcher.semantic;

import java.util.List;

/**
 * Turns texts into fixed-length vectors.
 *
 * <p>Implementations must return exactly one vector per input text, in input order, and
 * must be deterministic for identical text and model. The engine sends every chunk of both
 * documents in a single call.
 */
public interface EmbeddingProvider {

    /**
     * Embed a batch of texts.
     *
     * @param texts ordered texts to embed
     * @return one vector per text, in the same order
     * @throws ProviderException when the provider cannot produce the vectors
     */
    List<float[]> embed(List<String> texts);

    /**
     * Model identifier, for logging and reports.
     */
    String getModel();
}
