package com.moneylens.categorization.pipeline;

public record PipelineStats(
        int categories,
        double confidenceThreshold,
        double semanticThreshold,
        int manualOverridesCount,
        int retrainTrigger,
        int rulesLoaded,
        int semanticExamplesLoaded,
        boolean aiTrained,
        boolean semanticAvailable
) {
}
