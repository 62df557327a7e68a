package com.moneylens.categorization.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * State of the statistical classifier and its corpus.
 */
public record ModelInfo(
        boolean trained,
        int totalSamples,
        List<String> categories,
        Map<String, Integer> categoryDistribution,
        Instant trainedAt
) {
}
