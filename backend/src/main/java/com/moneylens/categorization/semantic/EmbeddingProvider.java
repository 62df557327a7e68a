package com.moneylens.categorization.semantic;

/**
 * Source of sentence embeddings. Implementations must return vectors of the same dimension for every input.
 */
public interface EmbeddingProvider {

    boolean isAvailable();

    /**
     * @throws EmbeddingProviderException when the provider is unreachable or returns an unusable response
     */
    double[] embed(String text);
}
