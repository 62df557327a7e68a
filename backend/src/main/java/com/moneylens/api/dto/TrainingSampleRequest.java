package com.moneylens.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/categorization/samples. Samples added here are imported (not manual) unless manual=true.
 */
public record TrainingSampleRequest(
        @NotBlank(message = "DESCRIPTION_REQUIRED")
        String description,
        @NotBlank(message = "CATEGORY_REQUIRED")
        String category,
        String subcategory,
        boolean manual
) {
}
