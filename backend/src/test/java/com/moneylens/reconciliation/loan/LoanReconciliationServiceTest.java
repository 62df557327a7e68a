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
import com.moneylens.reconciliation.config.ReconciliationProperties;
import com.moneylens.reconciliation.matcher.FuzzyReconciliationMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.moneylens.reconciliation.ReconciliationFixtures.loanPayment;
import static com.moneylens.reconciliation.ReconciliationFixtures.tx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LoanReconciliationServiceTest {

    private static final LocalDate DUE = LocalDate.of(2025, 11, 28);

    @Mock
    private LoanPaymentRepository loanPaymentRepository;
    @Mock
    private LoanRepository loanRepository;
    @Mock
    private TransactionRepository transactionRepository;

    private LoanReconciliationService service;

    @BeforeEach
    void setUp() {
        service = new LoanReconciliationService(loanPaymentRepository, loanRepository, transactionRepository,
                new FuzzyReconciliationMatcher(), new ReconciliationProperties());
    }

    private static Loan mortgage(String balance) {
        Loan loan = new Loan();
        loan.setId("loan-1");
        loan.setName("Bolån");
        loan.setCurrentBalance(new BigDecimal(balance));
        loan.setStatus(Loan.LoanStatus.ACTIVE);
        return loan;
    }

    @Test
    @DisplayName("amortization reduces the balance and is recorded")
    void principalReducesBalance() {
        Loan loan = mortgage("1500000.00");
        LoanPayment payment = loanPayment("p1", "loan-1", "Bolån", "5000.00", DUE);
        Transaction t = tx("t1", "Bolån amortering", "-5000.00", DUE);
        when(loanRepository.findById("loan-1")).thenReturn(Optional.of(loan));

        service.applyRepayment(payment, t);

        assertThat(payment.getKind()).isEqualTo(LoanPaymentKind.PRINCIPAL);
        assertThat(payment.getPaidAt()).isNotNull();
        assertThat(loan.getCurrentBalance()).isEqualByComparingTo("1495000.00");
        assertThat(loan.getRepayments()).singleElement().satisfies(r -> {
            assertThat(r.getKind()).isEqualTo(LoanPaymentKind.PRINCIPAL);
            assertThat(r.getAmount()).isEqualByComparingTo("5000.00");
            assertThat(r.getTransactionId()).isEqualTo("t1");
            assertThat(r.getLoanPaymentId()).isEqualTo("p1");
        });
        verify(loanRepository).save(loan);
        verify(loanPaymentRepository).save(payment);
        verify(transactionRepository).save(t);
    }

    @Test
    @DisplayName("interest is recorded without touching the balance")
    void interestLeavesBalance() {
        Loan loan = mortgage("1500000.00");
        LoanPayment payment = loanPayment("p1", "loan-1", "Bolån", "3200.00", DUE);
        Transaction t = tx("t1", "Bolån ränta", "-3200.00", DUE);
        when(loanRepository.findById("loan-1")).thenReturn(Optional.of(loan));

        service.applyRepayment(payment, t);

        assertThat(payment.getKind()).isEqualTo(LoanPaymentKind.INTEREST);
        assertThat(loan.getCurrentBalance()).isEqualByComparingTo("1500000.00");
        assertThat(loan.getRepayments()).hasSize(1);
    }

    @Test
    @DisplayName("missing loan: payment still saved, nothing recorded")
    void missingLoan() {
        LoanPayment payment = loanPayment("p1", "gone", "Bolån", "5000.00", DUE);
        when(loanRepository.findById("gone")).thenReturn(Optional.empty());

        service.applyRepayment(payment, tx("t1", "Bolån amortering", "-5000.00", DUE));

        verify(loanPaymentRepository).save(payment);
        verify(loanRepository, never()).save(any());
    }

    @Test
    @DisplayName("balance is floored at zero and the loan is paid off")
    void balanceFlooredAtZero() {
        Loan loan = mortgage("3000.00");

        LoanReconciliationService.reduceBalance(loan, new BigDecimal("5000.00"));

        assertThat(loan.getCurrentBalance()).isEqualByComparingTo("0");
        assertThat(loan.getStatus()).isEqualTo(Loan.LoanStatus.PAID_OFF);
    }

    @Test
    void partialReductionKeepsLoanActive() {
        Loan loan = mortgage("3000.00");

        LoanReconciliationService.reduceBalance(loan, new BigDecimal("1000.00"));

        assertThat(loan.getCurrentBalance()).isEqualByComparingTo("2000.00");
        assertThat(loan.getStatus()).isEqualTo(Loan.LoanStatus.ACTIVE);
    }

    @Test
    @DisplayName("full pass matches open payments and applies repayments")
    void reconcilePass() {
        Loan loan = mortgage("100000.00");
        LoanPayment amortization = loanPayment("p1", "loan-1", "Bolån", "5000.00", DUE);
        LoanPayment interest = loanPayment("p2", "loan-1", "Bolån ränta", "3200.00", DUE);
        Transaction t1 = tx("t1", "Bolån amortering", "-5000.00", DUE);
        Transaction t2 = tx("t2", "Bolån ränta", "-3200.00", DUE.plusDays(1));
        when(loanPaymentRepository.findByStatusInAndMatchedTransactionIdIsNullOrderByDueDateAsc(anyCollection()))
                .thenReturn(List.of(amortization, interest));
        when(transactionRepository.findByReconciledFalseAndDateBetweenOrderByDateAsc(any(), any()))
                .thenReturn(List.of(t1, t2));
        when(loanRepository.findById("loan-1")).thenReturn(Optional.of(loan));

        ReconciliationReport report = service.reconcile();

        assertThat(report.obligationsConsidered()).isEqualTo(2);
        assertThat(report.matches()).hasSize(2);
        assertThat(report.unmatched()).isZero();
        assertThat(amortization.getStatus()).isEqualTo(ObligationStatus.PAID);
        assertThat(interest.getKind()).isEqualTo(LoanPaymentKind.INTEREST);
        assertThat(loan.getCurrentBalance()).isEqualByComparingTo("95000.00");
        assertThat(loan.getRepayments()).hasSize(2);
    }

    @Test
    void nothingOpenMeansNoQuery() {
        when(loanPaymentRepository.findByStatusInAndMatchedTransactionIdIsNullOrderByDueDateAsc(anyCollection()))
                .thenReturn(List.of());

        ReconciliationReport report = service.reconcile();

        assertThat(report.matches()).isEmpty();
        verify(transactionRepository, never()).findByReconciledFalseAndDateBetweenOrderByDateAsc(any(), any());
    }
}
