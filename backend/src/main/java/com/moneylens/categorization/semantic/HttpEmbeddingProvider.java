package com.moneylens.categorization.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.moneylens.categorization.config.CategorizationProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Embeddings over an OpenAI-compatible endpoint: POST {"model","input"} and read data[0].embedding.
 * Throttled by a local limiter; results cached per text (embeddingCache).
 */
@Slf4j
public class HttpEmbeddingProvider implements EmbeddingProvider {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final CategorizationProperties.ProviderProperties provider;

    public HttpEmbeddingProvider(WebClient.Builder webClientBuilder,
                                 ObjectMapper objectMapper,
                                 RateLimiter embeddingRateLimiter,
                                 CategorizationProperties.ProviderProperties provider) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.rateLimiter = embeddingRateLimiter;
        this.provider = provider;
    }

    @Override
    public boolean isAvailable() {
        return provider.getUrl() != null && !provider.getUrl().isBlank();
    }

    @Override
    @Cacheable(cacheNames = "embeddingCache", key = "#text")
    public double[] embed(String text) {
        if (!isAvailable()) {
            throw new EmbeddingProviderException("No embedding provider configured");
        }
        if (!rateLimiter.acquirePermission()) {
            throw new EmbeddingProviderException("Local limiter timeout before embedding request");
        }
        String response;
        try {
            response = webClient.post()
                    .uri(provider.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (provider.getApiKey() != null && !provider.getApiKey().isBlank()) {
                            h.set(HttpHeaders.AUTHORIZATION, "Bearer " + provider.getApiKey());
                        }
                    })
                    .bodyValue(Map.of("model", provider.getModel(), "input", text))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(provider.getTimeoutMs()));
        } catch (WebClientResponseException e) {
            throw new EmbeddingProviderException("Embedding request failed: " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new EmbeddingProviderException("Embedding request error: " + e.getMessage(), e);
        }
        return parseEmbedding(response);
    }

    double[] parseEmbedding(String json) {
        if (json == null || json.isBlank()) {
            throw new EmbeddingProviderException("Empty embedding response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new EmbeddingProviderException("Malformed embedding response", e);
        }
        JsonNode vector = root.path("data").path(0).path("embedding");
        if (!vector.isArray() || vector.isEmpty()) {
            throw new EmbeddingProviderException("Embedding response has no data[0].embedding");
        }
        double[] out = new double[vector.size()];
        for (int i = 0; i < out.length; i++) {
            JsonNode v = vector.get(i);
            if (!v.isNumber()) {
                throw new EmbeddingProviderException("Non-numeric embedding component at " + i);
            }
            out[i] = v.asDouble();
        }
        return out;
    }
}
