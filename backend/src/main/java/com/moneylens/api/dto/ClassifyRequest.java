package com.moneylens.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/categorization/classify. Null strategy switches use the configured defaults.
 */
public record ClassifyRequest(
        @NotBlank(message = "DESCRIPTION_REQUIRED")
        String description,
        String merchant,
        Boolean useAi,
        Boolean useSemantic
) {
}
