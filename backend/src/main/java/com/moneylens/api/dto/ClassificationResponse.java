package com.moneylens.api.dto;

import com.moneylens.categorization.pipeline.ClassificationResult;

public record ClassificationResponse(
        String category,
        String subcategory,
        double confidenceScore,
        String source,
        boolean flagged,
        String detail
) {

    public static ClassificationResponse from(ClassificationResult r) {
        return new ClassificationResponse(r.category(), r.subcategory(), r.confidenceScore(),
                r.source().code(), r.flagged(), r.detail());
    }
}
