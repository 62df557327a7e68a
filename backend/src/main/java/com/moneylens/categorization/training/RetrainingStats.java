package com.moneylens.categorization.training;

import java.time.Instant;

public record RetrainingStats(
        int triggerThreshold,
        String modelType,
        boolean shouldRetrain,
        long totalSamples,
        Instant lastRetrain,
        Double lastAccuracy,
        Integer lastSamples,
        Boolean lastSuccess
) {
}
