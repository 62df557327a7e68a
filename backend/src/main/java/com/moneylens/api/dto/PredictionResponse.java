package com.moneylens.api.dto;

import com.moneylens.categorization.model.Prediction;

/**
 * Raw classifier output for one description; label and confidence are null when the model has no prediction.
 */
public record PredictionResponse(String description, String label, Double confidence) {

    public static PredictionResponse from(String description, Prediction prediction) {
        if (prediction == null) {
            return new PredictionResponse(description, null, null);
        }
        return new PredictionResponse(description, prediction.label(), prediction.confidence());
    }
}
