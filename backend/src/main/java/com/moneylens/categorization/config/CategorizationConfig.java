package com.moneylens.categorization.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.moneylens.categorization.semantic.EmbeddingProvider;
import com.moneylens.categorization.semantic.HttpEmbeddingProvider;
import com.moneylens.categorization.semantic.SemanticMatcher;
import com.moneylens.categorization.semantic.UnavailableEmbeddingProvider;
import com.moneylens.domain.CategoryTaxonomy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires taxonomy, embedding provider and semantic matcher from moneylens.categorization.
 */
@Configuration
@EnableConfigurationProperties(CategorizationProperties.class)
public class CategorizationConfig {

    @Bean
    public CategoryTaxonomy categoryTaxonomy(CategorizationProperties properties) {
        return new CategoryTaxonomy(properties.getTaxonomy());
    }

    @Bean(name = "embeddingRateLimiter")
    public RateLimiter embeddingRateLimiter(CategorizationProperties properties) {
        CategorizationProperties.ProviderProperties provider = properties.getSemantic().getProvider();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, provider.getRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, provider.getTimeoutMs())))
                .build();
        return RateLimiter.of("embedding", config);
    }

    /** Blank provider url = no provider; semantic matching then stays disabled. */
    @Bean
    public EmbeddingProvider embeddingProvider(CategorizationProperties properties,
                                               WebClient.Builder webClientBuilder,
                                               ObjectMapper objectMapper,
                                               @Qualifier("embeddingRateLimiter") RateLimiter embeddingRateLimiter) {
        CategorizationProperties.ProviderProperties provider = properties.getSemantic().getProvider();
        if (provider.getUrl() == null || provider.getUrl().isBlank()) {
            return new UnavailableEmbeddingProvider();
        }
        return new HttpEmbeddingProvider(webClientBuilder, objectMapper, embeddingRateLimiter, provider);
    }

    @Bean
    public SemanticMatcher semanticMatcher(EmbeddingProvider embeddingProvider, CategorizationProperties properties) {
        CategorizationProperties.SemanticProperties semantic = properties.getSemantic();
        return new SemanticMatcher(embeddingProvider, semantic.getExamples(),
                semantic.getSimilarityThreshold(), semantic.isEnabled());
    }
}
