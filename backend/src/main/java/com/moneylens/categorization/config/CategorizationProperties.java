package com.moneylens.categorization.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Categorization engine config. Documented in application.yml under moneylens.categorization.
 */
@ConfigurationProperties(prefix = "moneylens.categorization")
@NoArgsConstructor
@Getter
@Setter
public class CategorizationProperties {

    /** Minimum model confidence for an AI result to be accepted. */
    private double confidenceThreshold = 0.65;

    /** Minimum similarity for a semantic result to be accepted. */
    private double semanticThreshold = 0.75;

    /** Accepted semantic results below this similarity are flagged for review. */
    private double semanticReviewThreshold = 0.85;

    /** Manual overrides between automatic retrains. */
    private int retrainTrigger = 10;

    private boolean useAi = true;

    private boolean useSemantic = true;

    private String defaultCategory = "Other";

    private String defaultSubcategory = "Unknown";

    /** Ordered rule list; order breaks priority ties. */
    private List<RuleDefinition> rules = new ArrayList<>();

    /** Category -> subcategories. Labels outside a non-empty taxonomy are not trained. */
    private Map<String, List<String>> taxonomy = new LinkedHashMap<>();

    /** Max uncategorized transactions per job run. */
    private int batchSize = 500;

    /** Schedule interval of the categorization job in ms (fixedDelay). */
    private long scheduleIntervalMs = 300_000;

    private ModelProperties model = new ModelProperties();

    private RetrainingProperties retraining = new RetrainingProperties();

    private SemanticProperties semantic = new SemanticProperties();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RuleDefinition {
        private String pattern;
        private String category;
        private String subcategory;
        private int priority = 50;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ModelProperties {
        /** Vocabulary cap (unigrams + bigrams). */
        private int maxFeatures = 500;
        /** Additive (Lidstone) smoothing. */
        private double alpha = 0.1;
        private int minSamplesPerCategory = 2;
        private String modelType = "MultinomialNaiveBayes";
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RetrainingProperties {
        /** Corpus size at which shouldRetrain() reports true. */
        private int triggerThreshold = 10;
        /** Below this corpus size run() reports insufficient data without training. */
        private int minSamples = 4;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class SemanticProperties {
        private boolean enabled = true;
        private double similarityThreshold = 0.75;
        /** Category -> subcategory -> example phrases. Order is the tie-break order. */
        private Map<String, Map<String, List<String>>> examples = new LinkedHashMap<>();
        private ProviderProperties provider = new ProviderProperties();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ProviderProperties {
        /** OpenAI-compatible embeddings endpoint, e.g. http://localhost:11434/v1/embeddings. Blank = no provider. */
        private String url = "";
        private String model = "all-minilm";
        private String apiKey = "";
        private long timeoutMs = 5_000;
        private int requestsPerSecond = 20;
    }
}
