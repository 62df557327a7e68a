package com.moneylens.categorization.training;

import java.time.Instant;

/**
 * Outcome of one retraining run. accuracy is samplesUsed / corpus size (coarse proxy, no held-out set).
 */
public record RetrainingResult(
        boolean success,
        Instant timestamp,
        String modelType,
        int samplesUsed,
        double accuracy,
        String message
) {
}
