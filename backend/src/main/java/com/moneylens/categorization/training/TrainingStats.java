package com.moneylens.categorization.training;

import java.util.Map;

/**
 * Corpus statistics. categoryCounts is keyed by training label; readyToTrain mirrors the classifier's minimums
 * (2 labels with enough samples each).
 */
public record TrainingStats(
        long totalSamples,
        long manualSamples,
        Map<String, Integer> categoryCounts,
        boolean readyToTrain,
        int minSamplesNeeded
) {
}
