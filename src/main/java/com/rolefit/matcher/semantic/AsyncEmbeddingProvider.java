package com.rolefit.matcher.semantic;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Non-blocking variant of {@link EmbeddingProvider}. Same ordering contract.
 */
@FunctionalInterface
public interface AsyncEmbeddingProvider {

    CompletableFuture<List<float[]>> embedAsync(List<String> texts);

    /**
     * Adapt a blocking provider by running it on the given executor.
     */
    static AsyncEmbeddingProvider from(EmbeddingProvider provider, Executor executor) {
        return texts -> CompletableFuture.supplyAsync(() -> {
            try {
                return provider.embed(texts);
            } catch (ProviderException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
