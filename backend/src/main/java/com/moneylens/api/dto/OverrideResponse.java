package com.moneylens.api.dto;

import com.moneylens.categorization.training.RetrainingResult;

public record OverrideResponse(
        String transactionId,
        int overrideCount,
        boolean retrainTriggered,
        RetrainingResult retraining
) {
}
