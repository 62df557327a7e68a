package com.moneylens.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * POST /api/v1/categorization/model/predict.
 */
public record BatchPredictRequest(
        @NotEmpty(message = "DESCRIPTIONS_REQUIRED")
        List<String> descriptions
) {
}
