package com.moneylens.reconciliation.job;

import com.moneylens.reconciliation.ObligationStatusService;
import com.moneylens.reconciliation.bill.BillReconciliationService;
import com.moneylens.reconciliation.loan.LoanReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic reconciliation of bills and loan payments, and the daily overdue transition.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReconciliationJob {

    private final BillReconciliationService billReconciliationService;
    private final LoanReconciliationService loanReconciliationService;
    private final ObligationStatusService obligationStatusService;

    @Scheduled(fixedDelayString = "${moneylens.reconciliation.schedule-interval-ms:3600000}")
    public void runScheduled() {
        try {
            billReconciliationService.reconcile();
        } catch (RuntimeException e) {
            log.error("Bill reconciliation run failed", e);
        }
        try {
            loanReconciliationService.reconcile();
        } catch (RuntimeException e) {
            log.error("Loan reconciliation run failed", e);
        }
    }

    @Scheduled(cron = "${moneylens.reconciliation.overdue-cron:0 5 0 * * *}")
    public void markOverdue() {
        try {
            obligationStatusService.markOverdue();
        } catch (RuntimeException e) {
            log.error("Overdue transition failed", e);
        }
    }
}
