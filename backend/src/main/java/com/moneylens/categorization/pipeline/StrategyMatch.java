package com.moneylens.categorization.pipeline;

import com.moneylens.categorization.CategoryLabel;

/**
 * Raw strategy output before pipeline thresholds. Detail is strategy specific (matched pattern, closest example).
 */
public record StrategyMatch(CategoryLabel label, double score, String detail) {
}
