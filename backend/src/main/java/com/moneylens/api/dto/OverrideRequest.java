package com.moneylens.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * PUT /api/v1/categorization/transactions/{id}/category. addTrainingSample defaults to true.
 */
public record OverrideRequest(
        @NotBlank(message = "CATEGORY_REQUIRED")
        String category,
        String subcategory,
        Boolean addTrainingSample
) {
}
