package com.moneylens.categorization.semantic;

/**
 * Used when no embeddings endpoint is configured. Semantic matching stays disabled.
 */
public class UnavailableEmbeddingProvider implements EmbeddingProvider {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public double[] embed(String text) {
        throw new EmbeddingProviderException("No embedding provider configured");
    }
}
