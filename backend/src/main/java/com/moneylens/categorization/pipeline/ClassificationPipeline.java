package com.moneylens.categorization.pipeline;

import com.moneylens.categorization.config.CategorizationProperties;
import com.moneylens.categorization.model.AiClassificationStrategy;
import com.moneylens.categorization.model.StatisticalClassifier;
import com.moneylens.categorization.rule.RuleBook;
import com.moneylens.categorization.rule.RuleClassificationStrategy;
import com.moneylens.categorization.semantic.SemanticClassificationStrategy;
import com.moneylens.categorization.semantic.SemanticMatcher;
import com.moneylens.categorization.training.RetrainingResult;
import com.moneylens.categorization.training.RetrainingService;
import com.moneylens.categorization.training.TrainingSampleService;
import com.moneylens.domain.CategoryTaxonomy;
import com.moneylens.domain.ClassificationSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Chain: AI (confidence-threshold) → SEMANTIC (semantic-threshold) → RULE → DEFAULT.
 * A strategy that fails or has no result is skipped; the default bucket is always flagged.
 * Also owns the manual-override counter that triggers retraining.
 */
@Component
@Slf4j
public class ClassificationPipeline {

    private final ClassificationStrategy aiStrategy;
    private final ClassificationStrategy semanticStrategy;
    private final ClassificationStrategy ruleStrategy;
    private final TrainingSampleService trainingSampleService;
    private final RetrainingService retrainingService;
    private final CategorizationProperties properties;
    private final CategoryTaxonomy taxonomy;
    private final RuleBook ruleBook;
    private final SemanticMatcher semanticMatcher;
    private final StatisticalClassifier statisticalClassifier;
    private final OverrideCounter overrideCounter = new OverrideCounter();

    public ClassificationPipeline(AiClassificationStrategy aiStrategy,
                                  SemanticClassificationStrategy semanticStrategy,
                                  RuleClassificationStrategy ruleStrategy,
                                  TrainingSampleService trainingSampleService,
                                  RetrainingService retrainingService,
                                  CategorizationProperties properties,
                                  CategoryTaxonomy taxonomy,
                                  RuleBook ruleBook,
                                  SemanticMatcher semanticMatcher,
                                  StatisticalClassifier statisticalClassifier) {
        this.aiStrategy = aiStrategy;
        this.semanticStrategy = semanticStrategy;
        this.ruleStrategy = ruleStrategy;
        this.trainingSampleService = trainingSampleService;
        this.retrainingService = retrainingService;
        this.properties = properties;
        this.taxonomy = taxonomy;
        this.ruleBook = ruleBook;
        this.semanticMatcher = semanticMatcher;
        this.statisticalClassifier = statisticalClassifier;
    }

    public ClassificationResult classify(ClassificationRequest request) {
        String text = request.text();
        boolean useAi = request.useAi() != null ? request.useAi() : properties.isUseAi();
        boolean useSemantic = request.useSemantic() != null ? request.useSemantic() : properties.isUseSemantic();

        if (useAi) {
            Optional<StrategyMatch> ai = tryStrategy(aiStrategy, text);
            if (ai.isPresent() && ai.get().score() >= properties.getConfidenceThreshold()) {
                return accepted(ai.get(), ClassificationSource.AI, false, text);
            }
        }
        if (useSemantic) {
            Optional<StrategyMatch> semantic = tryStrategy(semanticStrategy, text);
            if (semantic.isPresent() && semantic.get().score() >= properties.getSemanticThreshold()) {
                return accepted(semantic.get(), ClassificationSource.SEMANTIC,
                        semantic.get().score() < properties.getSemanticReviewThreshold(), text);
            }
        }
        Optional<StrategyMatch> rule = tryStrategy(ruleStrategy, text);
        if (rule.isPresent()) {
            return accepted(new StrategyMatch(rule.get().label(), 1.0, rule.get().detail()),
                    ClassificationSource.RULE, false, text);
        }
        log.debug("No strategy matched '{}', using default bucket", text);
        return new ClassificationResult(properties.getDefaultCategory(), properties.getDefaultSubcategory(),
                0.0, ClassificationSource.DEFAULT, true, null);
    }

    public ClassificationResult classify(String description) {
        return classify(ClassificationRequest.of(description));
    }

    private Optional<StrategyMatch> tryStrategy(ClassificationStrategy strategy, String text) {
        try {
            return strategy.tryClassify(text);
        } catch (RuntimeException e) {
            log.warn("{} strategy failed for '{}': {}", strategy.source(), text, e.getMessage());
            return Optional.empty();
        }
    }

    private ClassificationResult accepted(StrategyMatch match, ClassificationSource source, boolean flagged, String text) {
        log.debug("{} categorized '{}' -> {}/{} ({})", source, text,
                match.label().category(), match.label().subcategory(), match.score());
        return new ClassificationResult(match.label().category(), match.label().subcategory(),
                match.score(), source, flagged, match.detail());
    }

    /**
     * Record a manual correction. When the counter reaches retrain-trigger, retrains synchronously and resets
     * the counter whatever the retrain outcome.
     *
     * @param addTrainingSample whether the correction is added to the training corpus
     */
    public synchronized OverrideRegistration registerOverride(String category, String subcategory,
                                                               String description, boolean addTrainingSample) {
        if (addTrainingSample) {
            trainingSampleService.addSample(description, category, subcategory, true);
        }
        int count = overrideCounter.increment();
        log.info("Manual override registered: {} -> {}/{} ({} of {})",
                description, category, subcategory, count, properties.getRetrainTrigger());
        if (count < properties.getRetrainTrigger()) {
            return new OverrideRegistration(count, false, null);
        }
        log.info("Retrain trigger ({}) reached, retraining", properties.getRetrainTrigger());
        RetrainingResult retraining;
        try {
            retraining = retrainingService.run();
        } finally {
            overrideCounter.reset();
        }
        log.info("Automatic retraining finished: success={} message={}", retraining.success(), retraining.message());
        return new OverrideRegistration(overrideCounter.get(), true, retraining);
    }

    public OverrideRegistration registerOverride(String category, String subcategory, String description) {
        return registerOverride(category, subcategory, description, true);
    }

    public int getOverrideCount() {
        return overrideCounter.get();
    }

    public PipelineStats getStats() {
        return new PipelineStats(
                taxonomy.getCategories().size(),
                properties.getConfidenceThreshold(),
                properties.getSemanticThreshold(),
                overrideCounter.get(),
                properties.getRetrainTrigger(),
                ruleBook.matcher().size(),
                semanticMatcher.exampleCount(),
                statisticalClassifier.isTrained(),
                semanticMatcher.isAvailable());
    }
}
