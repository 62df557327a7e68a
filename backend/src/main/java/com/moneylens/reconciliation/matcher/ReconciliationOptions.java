package com.moneylens.reconciliation.matcher;

/**
 * Tolerances for one reconciliation pass.
 */
public record ReconciliationOptions(int dateToleranceDays, double amountTolerancePercent, double acceptanceThreshold) {

    public static final int DEFAULT_DATE_TOLERANCE_DAYS = 7;
    public static final double DEFAULT_AMOUNT_TOLERANCE_PERCENT = 5.0;
    public static final double DEFAULT_ACCEPTANCE_THRESHOLD = 0.7;

    public ReconciliationOptions {
        if (dateToleranceDays < 0) {
            throw new IllegalArgumentException("dateToleranceDays must be >= 0");
        }
        if (amountTolerancePercent < 0) {
            throw new IllegalArgumentException("amountTolerancePercent must be >= 0");
        }
    }

    public static ReconciliationOptions defaults() {
        return new ReconciliationOptions(DEFAULT_DATE_TOLERANCE_DAYS, DEFAULT_AMOUNT_TOLERANCE_PERCENT,
                DEFAULT_ACCEPTANCE_THRESHOLD);
    }
}
