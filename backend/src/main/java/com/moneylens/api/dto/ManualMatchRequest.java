package com.moneylens.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ManualMatchRequest(
        @NotBlank(message = "TRANSACTION_REQUIRED")
        String transactionId
) {
}
