package com.moneylens.reconciliation.loan;

import com.moneylens.domain.Loan;
import com.moneylens.domain.LoanPayment;
import com.moneylens.domain.LoanPaymentKind;
import com.moneylens.domain.LoanPaymentRepository;
import com.moneylens.domain.LoanRepository;
import com.moneylens.domain.ObligationStatus;
import com.moneylens.domain.Transaction;
import com.moneylens.domain.TransactionRepository;
import com.moneylens.reconciliation.ReconciliationReport;
import com.moneylens.reconciliation.TransactionWindow;
import com.moneylens.reconciliation.config.ReconciliationProperties;
import com.moneylens.reconciliation.matcher.FuzzyReconciliationMatcher;
import com.moneylens.reconciliation.matcher.MatchCandidate;
import com.moneylens.reconciliation.matcher.ReconciliationOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scheduled loan payments against bank transactions. Every matched payment is recorded on its loan;
 * principal payments also reduce the outstanding balance (floored at 0, loan PAID_OFF at 0).
 */
@Service
@Slf4j
public class LoanReconciliationService {

    private final LoanPaymentRepository loanPaymentRepository;
    private final LoanRepository loanRepository;
    private final TransactionRepository transactionRepository;
    private final FuzzyReconciliationMatcher matcher;
    private final ReconciliationProperties properties;
    private final LoanPaymentClassifier paymentClassifier;

    public LoanReconciliationService(LoanPaymentRepository loanPaymentRepository,
                                     LoanRepository loanRepository,
                                     TransactionRepository transactionRepository,
                                     FuzzyReconciliationMatcher matcher,
                                     ReconciliationProperties properties) {
        this.loanPaymentRepository = loanPaymentRepository;
        this.loanRepository = loanRepository;
        this.transactionRepository = transactionRepository;
        this.matcher = matcher;
        this.properties = properties;
        this.paymentClassifier = new LoanPaymentClassifier(properties.getInterestKeywords());
    }

    public ReconciliationReport reconcile() {
        return reconcile(properties.toOptions());
    }

    public ReconciliationReport reconcile(ReconciliationOptions options) {
        List<LoanPayment> payments = loanPaymentRepository
                .findByStatusInAndMatchedTransactionIdIsNullOrderByDueDateAsc(ObligationStatus.openStatuses());
        if (payments.isEmpty()) {
            return new ReconciliationReport(0, 0, List.of());
        }
        List<Transaction> transactions = TransactionWindow.load(transactionRepository, payments,
                options.dateToleranceDays());
        List<MatchCandidate> matches = matcher.reconcile(payments, transactions, options);

        Map<String, LoanPayment> paymentsByRef = new HashMap<>();
        payments.forEach(p -> paymentsByRef.put(p.reference(), p));
        Map<String, Transaction> txById = new HashMap<>();
        transactions.forEach(t -> txById.put(t.getId(), t));
        for (MatchCandidate match : matches) {
            applyRepayment(paymentsByRef.get(match.obligationRef()), txById.get(match.transactionId()));
        }
        log.info("Loan reconciliation: {} of {} open payment(s) matched against {} transaction(s)",
                matches.size(), payments.size(), transactions.size());
        return new ReconciliationReport(payments.size(), transactions.size(), matches);
    }

    void applyRepayment(LoanPayment payment, Transaction tx) {
        Instant now = Instant.now();
        LoanPaymentKind kind = paymentClassifier.classify(tx.getDescription());
        payment.setKind(kind);
        payment.setPaidAt(now);
        tx.setUpdatedAt(now);
        loanPaymentRepository.save(payment);
        transactionRepository.save(tx);

        Optional<Loan> loanOpt = payment.getLoanId() == null ? Optional.empty() : loanRepository.findById(payment.getLoanId());
        if (loanOpt.isEmpty()) {
            log.warn("Loan {} of payment {} not found; repayment not recorded", payment.getLoanId(), payment.getId());
            return;
        }
        Loan loan = loanOpt.get();
        BigDecimal amount = tx.getAmount().abs();
        Loan.Repayment repayment = new Loan.Repayment();
        repayment.setDate(tx.getDate());
        repayment.setAmount(amount);
        repayment.setKind(kind);
        repayment.setTransactionId(tx.getId());
        repayment.setLoanPaymentId(payment.getId());
        repayment.setRecordedAt(now);
        loan.getRepayments().add(repayment);
        if (kind == LoanPaymentKind.PRINCIPAL) {
            reduceBalance(loan, amount);
        }
        loanRepository.save(loan);
        log.info("Recorded {} repayment {} on loan {}; balance {}", kind, amount, loan.getId(), loan.getCurrentBalance());
    }

    static void reduceBalance(Loan loan, BigDecimal amount) {
        BigDecimal current = loan.getCurrentBalance() != null ? loan.getCurrentBalance() : BigDecimal.ZERO;
        BigDecimal next = current.subtract(amount);
        if (next.signum() <= 0) {
            next = BigDecimal.ZERO;
            loan.setStatus(Loan.LoanStatus.PAID_OFF);
        }
        loan.setCurrentBalance(next);
    }
}
