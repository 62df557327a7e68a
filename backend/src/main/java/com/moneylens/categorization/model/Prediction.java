package com.moneylens.categorization.model;

/**
 * Predicted training label. Confidence (posterior of the label, in [0,1]) is null unless requested.
 */
public record Prediction(String label, Double confidence) {
}
