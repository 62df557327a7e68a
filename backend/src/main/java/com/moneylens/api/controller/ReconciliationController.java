package com.moneylens.api.controller;

import com.moneylens.api.dto.CountResponse;
import com.moneylens.api.dto.ManualMatchRequest;
import com.moneylens.api.dto.UnmatchedBillResponse;
import com.moneylens.reconciliation.ObligationStatusService;
import com.moneylens.reconciliation.ReconciliationReport;
import com.moneylens.reconciliation.bill.BillReconciliationService;
import com.moneylens.reconciliation.loan.LoanReconciliationService;
import com.moneylens.reconciliation.matcher.MatchCandidate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * On-demand reconciliation runs, manual bill matching, unmatched bills.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final BillReconciliationService billReconciliationService;
    private final LoanReconciliationService loanReconciliationService;
    private final ObligationStatusService obligationStatusService;

    @PostMapping("/bills/run")
    public ResponseEntity<ReconciliationReport> reconcileBills() {
        return ResponseEntity.ok(billReconciliationService.reconcile());
    }

    @PostMapping("/loans/run")
    public ResponseEntity<ReconciliationReport> reconcileLoans() {
        return ResponseEntity.ok(loanReconciliationService.reconcile());
    }

    @PostMapping("/bills/{billId}/match")
    public ResponseEntity<MatchCandidate> manualMatch(@PathVariable String billId,
                                                      @Valid @RequestBody ManualMatchRequest request) {
        return ResponseEntity.ok(billReconciliationService.manualMatch(billId, request.transactionId()));
    }

    @GetMapping("/bills/unmatched")
    public ResponseEntity<List<UnmatchedBillResponse>> unmatchedBills() {
        return ResponseEntity.ok(billReconciliationService.getUnmatchedBills().stream()
                .map(UnmatchedBillResponse::from)
                .toList());
    }

    @PostMapping("/overdue")
    public ResponseEntity<CountResponse> markOverdue() {
        return ResponseEntity.ok(new CountResponse(obligationStatusService.markOverdue()));
    }
}
