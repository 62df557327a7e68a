package com.moneylens.categorization.pipeline;

import com.moneylens.domain.ClassificationSource;

import java.util.Optional;

/**
 * One way of categorizing a transaction text. The pipeline queries strategies in a fixed priority order
 * and applies its own acceptance thresholds to the returned score.
 */
public interface ClassificationStrategy {

    ClassificationSource source();

    /**
     * @param text description (and merchant, when known)
     * @return best label with its score in [0,1], or empty when this strategy has nothing to say
     */
    Optional<StrategyMatch> tryClassify(String text);
}
