package com.moneylens.reconciliation.bill;

import com.moneylens.domain.Bill;
import com.moneylens.domain.BillRepository;
import com.moneylens.domain.ObligationStatus;
import com.moneylens.domain.Transaction;
import com.moneylens.domain.TransactionRepository;
import com.moneylens.reconciliation.ReconciliationException;
import com.moneylens.reconciliation.ReconciliationReport;
import com.moneylens.reconciliation.TransactionWindow;
import com.moneylens.reconciliation.config.ReconciliationProperties;
import com.moneylens.reconciliation.matcher.FuzzyReconciliationMatcher;
import com.moneylens.reconciliation.matcher.MatchCandidate;
import com.moneylens.reconciliation.matcher.MatchScorer;
import com.moneylens.reconciliation.matcher.ReconciliationOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bills against bank transactions: automatic pass, manual match, unmatched listing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillReconciliationService {

    private final BillRepository billRepository;
    private final TransactionRepository transactionRepository;
    private final FuzzyReconciliationMatcher matcher;
    private final ReconciliationProperties properties;

    public ReconciliationReport reconcile() {
        return reconcile(properties.toOptions());
    }

    public ReconciliationReport reconcile(ReconciliationOptions options) {
        List<Bill> bills = billRepository.findByStatusInAndMatchedTransactionIdIsNullOrderByDueDateAsc(ObligationStatus.openStatuses());
        if (bills.isEmpty()) {
            return new ReconciliationReport(0, 0, List.of());
        }
        List<Transaction> transactions = loadTransactions(bills, options.dateToleranceDays());
        List<MatchCandidate> matches = matcher.reconcile(bills, transactions, options);
        persist(bills, transactions, matches);
        log.info("Bill reconciliation: {} of {} open bill(s) matched against {} transaction(s)",
                matches.size(), bills.size(), transactions.size());
        return new ReconciliationReport(bills.size(), transactions.size(), matches);
    }

    private List<Transaction> loadTransactions(List<Bill> bills, int dateToleranceDays) {
        return TransactionWindow.load(transactionRepository, bills, dateToleranceDays);
    }

    private void persist(List<Bill> bills, List<Transaction> transactions, List<MatchCandidate> matches) {
        if (matches.isEmpty()) {
            return;
        }
        Map<String, Bill> billsByRef = new HashMap<>();
        bills.forEach(b -> billsByRef.put(b.reference(), b));
        Map<String, Transaction> txById = new HashMap<>();
        transactions.forEach(t -> txById.put(t.getId(), t));
        Instant now = Instant.now();
        for (MatchCandidate match : matches) {
            Bill bill = billsByRef.get(match.obligationRef());
            Transaction tx = txById.get(match.transactionId());
            bill.setPaidAt(now);
            tx.setUpdatedAt(now);
            billRepository.save(bill);
            transactionRepository.save(tx);
        }
    }

    /**
     * Link a bill to a transaction chosen by the user. Tolerances are not checked.
     *
     * @throws ReconciliationException NOT_FOUND for an unknown bill or transaction; ALREADY_MATCHED when the bill
     *                                 is paid or linked, or the transaction is already reconciled
     */
    public MatchCandidate manualMatch(String billId, String transactionId) {
        Bill bill = billRepository.findById(billId)
                .orElseThrow(() -> new ReconciliationException(ReconciliationException.NOT_FOUND, "Bill not found: " + billId));
        Transaction tx = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new ReconciliationException(ReconciliationException.NOT_FOUND,
                        "Transaction not found: " + transactionId));
        if (!bill.isOpenForMatching()) {
            throw new ReconciliationException(ReconciliationException.ALREADY_MATCHED,
                    "Bill " + billId + " is already " + bill.getStatus());
        }
        if (tx.isReconciled()) {
            throw new ReconciliationException(ReconciliationException.ALREADY_MATCHED,
                    "Transaction " + transactionId + " already reconciled with " + tx.getMatchedObligationRef());
        }
        Instant now = Instant.now();
        bill.setStatus(ObligationStatus.PAID);
        bill.setMatchedTransactionId(tx.getId());
        bill.setPaidAt(now);
        tx.markReconciled(bill.reference());
        tx.setUpdatedAt(now);
        billRepository.save(bill);
        transactionRepository.save(tx);
        log.info("Manually matched {} with transaction {}", bill.reference(), tx.getId());
        BigDecimal diff = bill.getAmount() != null && tx.getAmount() != null
                ? MatchScorer.amountDiff(bill.getAmount(), tx.getAmount()) : null;
        return new MatchCandidate(bill.reference(), tx.getId(), 1.0, diff);
    }

    public List<Bill> getUnmatchedBills() {
        return billRepository.findByStatusInAndMatchedTransactionIdIsNullOrderByDueDateAsc(ObligationStatus.openStatuses());
    }
}
