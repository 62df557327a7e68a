package com.moneylens.categorization.job;

import com.moneylens.categorization.TransactionCategorizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically categorizes imported transactions that have no category yet.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TransactionCategorizationJob {

    private final TransactionCategorizationService transactionCategorizationService;

    @Scheduled(fixedDelayString = "${moneylens.categorization.schedule-interval-ms:300000}")
    public void runScheduled() {
        try {
            transactionCategorizationService.categorizeUncategorized();
        } catch (RuntimeException e) {
            log.error("Categorization job run failed", e);
        }
    }
}
