package com.moneylens.categorization.semantic;

import com.moneylens.categorization.CategoryLabel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nearest-example matcher over embedded reference phrases (cosine similarity).
 * Example embeddings are computed once at construction; if the provider is unavailable or fails then,
 * the matcher is disabled for its lifetime and every {@link #match(String)} is empty.
 */
@Slf4j
public class SemanticMatcher {

    private final EmbeddingProvider provider;
    private final double similarityThreshold;
    private final List<SemanticExample> examples;
    private final boolean enabled;

    public SemanticMatcher(EmbeddingProvider provider,
                           Map<String, Map<String, List<String>>> examplesByCategory,
                           double similarityThreshold,
                           boolean enabled) {
        this.provider = provider;
        this.similarityThreshold = similarityThreshold;
        List<SemanticExample> cache = enabled ? embedExamples(provider, examplesByCategory) : null;
        this.examples = cache == null ? List.of() : Collections.unmodifiableList(cache);
        this.enabled = cache != null && !cache.isEmpty();
        if (this.enabled) {
            log.info("Semantic matcher ready: {} example(s)", this.examples.size());
        }
    }

    private static List<SemanticExample> embedExamples(EmbeddingProvider provider,
                                                       Map<String, Map<String, List<String>>> examplesByCategory) {
        if (!provider.isAvailable()) {
            log.info("Semantic matcher disabled: no embedding provider");
            return null;
        }
        List<SemanticExample> out = new ArrayList<>();
        try {
            for (Map.Entry<String, Map<String, List<String>>> cat : examplesByCategory.entrySet()) {
                for (Map.Entry<String, List<String>> sub : cat.getValue().entrySet()) {
                    CategoryLabel label = new CategoryLabel(cat.getKey(), sub.getKey());
                    for (String phrase : sub.getValue()) {
                        if (phrase == null || phrase.isBlank()) {
                            continue;
                        }
                        out.add(new SemanticExample(label, phrase, provider.embed(phrase)));
                    }
                }
            }
        } catch (EmbeddingProviderException e) {
            log.warn("Semantic matcher disabled: embedding reference examples failed: {}", e.getMessage());
            return null;
        }
        return out;
    }

    public boolean isAvailable() {
        return enabled;
    }

    public int exampleCount() {
        return examples.size();
    }

    /**
     * @return closest example when its similarity reaches the threshold; ties keep the earlier example
     */
    public Optional<SemanticMatch> match(String text) {
        if (!enabled || text == null || text.isBlank()) {
            return Optional.empty();
        }
        SemanticExample best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        try {
            double[] query = provider.embed(text);
            for (SemanticExample example : examples) {
                double score = cosine(query, example.embedding());
                if (score > bestScore) {
                    bestScore = score;
                    best = example;
                }
            }
        } catch (EmbeddingProviderException e) {
            log.warn("Semantic match skipped: {}", e.getMessage());
            return Optional.empty();
        }
        if (best == null || bestScore < similarityThreshold) {
            return Optional.empty();
        }
        return Optional.of(new SemanticMatch(best.label().category(), best.label().subcategory(),
                bestScore, best.phrase()));
    }

    static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new EmbeddingProviderException("Embedding dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
