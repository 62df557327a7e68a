package com.moneylens.categorization.semantic;

/**
 * Embedding provider failure (transport error, rate limit, malformed response).
 */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
