package com.moneylens.categorization.pipeline;

import com.moneylens.domain.ClassificationSource;

/**
 * Pipeline outcome. flagged = a human should review it.
 */
public record ClassificationResult(
        String category,
        String subcategory,
        double confidenceScore,
        ClassificationSource source,
        boolean flagged,
        String detail
) {
}
