package com.moneylens.reconciliation.config;

import com.moneylens.reconciliation.matcher.ReconciliationOptions;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciliation tolerances and schedules. Documented in application.yml under moneylens.reconciliation.
 */
@ConfigurationProperties(prefix = "moneylens.reconciliation")
@NoArgsConstructor
@Getter
@Setter
public class ReconciliationProperties {

    private int dateToleranceDays = ReconciliationOptions.DEFAULT_DATE_TOLERANCE_DAYS;
    private double amountTolerancePercent = ReconciliationOptions.DEFAULT_AMOUNT_TOLERANCE_PERCENT;
    private double acceptanceThreshold = ReconciliationOptions.DEFAULT_ACCEPTANCE_THRESHOLD;

    /** Description keywords marking a loan repayment as interest; anything else is principal. */
    private List<String> interestKeywords = new ArrayList<>(List.of("ränta", "interest", "räntebetalning"));

    /** Reconciliation job interval in ms (fixedDelay). */
    private long scheduleIntervalMs = 3_600_000;

    /** Overdue transition schedule. */
    private String overdueCron = "0 5 0 * * *";

    public ReconciliationOptions toOptions() {
        return new ReconciliationOptions(dateToleranceDays, amountTolerancePercent, acceptanceThreshold);
    }
}
