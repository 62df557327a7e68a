package com.moneylens.categorization.pipeline;

import com.moneylens.categorization.training.RetrainingResult;

/**
 * @param overrideCount counter value after this registration (0 when it triggered a retrain)
 * @param retraining    result of the triggered retrain, null when none was triggered
 */
public record OverrideRegistration(int overrideCount, boolean retrainTriggered, RetrainingResult retraining) {
}
