package com.moneylens.categorization.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link StatisticalClassifier#train(int)}. Failure is reported here, never thrown.
 *
 * @param categories     labels the model was trained on (or the valid ones found, on failure)
 * @param categoryCounts samples per label in the whole corpus, including excluded labels
 */
public record TrainingResult(
        boolean success,
        String message,
        int samplesUsed,
        List<String> categories,
        Map<String, Integer> categoryCounts
) {

    static TrainingResult failure(String message, List<String> categories, Map<String, Integer> categoryCounts) {
        return new TrainingResult(false, message, 0, categories, categoryCounts);
    }
}
