package com.moneylens.categorization.model;

import com.moneylens.categorization.CategoryLabel;
import com.moneylens.categorization.config.CategorizationProperties;
import com.moneylens.categorization.pipeline.ClassificationStrategy;
import com.moneylens.categorization.pipeline.StrategyMatch;
import com.moneylens.domain.ClassificationSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Statistical classifier as a pipeline strategy. Score = posterior of the predicted label.
 * A prediction of the default category is not a result.
 */
@Component
@RequiredArgsConstructor
public class AiClassificationStrategy implements ClassificationStrategy {

    private final StatisticalClassifier statisticalClassifier;
    private final CategorizationProperties properties;

    @Override
    public ClassificationSource source() {
        return ClassificationSource.AI;
    }

    @Override
    public Optional<StrategyMatch> tryClassify(String text) {
        return statisticalClassifier.predict(text, true)
                .filter(p -> p.confidence() != null)
                .map(p -> new StrategyMatch(
                        CategoryLabel.fromTrainingLabel(p.label(), properties.getDefaultSubcategory()),
                        p.confidence(),
                        p.label()))
                .filter(m -> !properties.getDefaultCategory().equals(m.label().category()));
    }
}
