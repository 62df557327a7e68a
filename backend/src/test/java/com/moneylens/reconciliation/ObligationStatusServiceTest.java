package com.moneylens.reconciliation;

import com.moneylens.domain.Bill;
import com.moneylens.domain.BillRepository;
import com.moneylens.domain.LoanPayment;
import com.moneylens.domain.LoanPaymentRepository;
import com.moneylens.domain.ObligationStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static com.moneylens.reconciliation.ReconciliationFixtures.bill;
import static com.moneylens.reconciliation.ReconciliationFixtures.loanPayment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObligationStatusServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 12, 1);

    @Mock
    private BillRepository billRepository;
    @Mock
    private LoanPaymentRepository loanPaymentRepository;

    @InjectMocks
    private ObligationStatusService service;

    @Test
    void pastDueObligationsBecomeOverdue() {
        Bill bill = bill("b1", "Electricity", "850.00", TODAY.minusDays(3));
        LoanPayment payment = loanPayment("p1", "loan-1", "Bolån", "5000.00", TODAY.minusDays(1));
        payment.setStatus(ObligationStatus.POSTED);
        EnumSet<ObligationStatus> pending = EnumSet.of(ObligationStatus.SCHEDULED, ObligationStatus.POSTED);
        when(billRepository.findByStatusInAndDueDateBefore(pending, TODAY)).thenReturn(List.of(bill));
        when(loanPaymentRepository.findByStatusInAndDueDateBefore(pending, TODAY)).thenReturn(List.of(payment));

        int moved = service.markOverdue(TODAY);

        assertThat(moved).isEqualTo(2);
        assertThat(bill.getStatus()).isEqualTo(ObligationStatus.OVERDUE);
        assertThat(payment.getStatus()).isEqualTo(ObligationStatus.OVERDUE);
        verify(billRepository).saveAll(List.of(bill));
        verify(loanPaymentRepository).saveAll(List.of(payment));
    }

    @Test
    void nothingDue() {
        EnumSet<ObligationStatus> pending = EnumSet.of(ObligationStatus.SCHEDULED, ObligationStatus.POSTED);
        when(billRepository.findByStatusInAndDueDateBefore(pending, TODAY)).thenReturn(List.of());
        when(loanPaymentRepository.findByStatusInAndDueDateBefore(pending, TODAY)).thenReturn(List.of());

        assertThat(service.markOverdue(TODAY)).isZero();
    }

    @Test
    void statusTransitions() {
        assertThat(ObligationStatus.SCHEDULED.canBecomeOverdue()).isTrue();
        assertThat(ObligationStatus.OVERDUE.canBecomeOverdue()).isFalse();
        assertThat(ObligationStatus.OVERDUE.isOpen()).isTrue();
        assertThat(ObligationStatus.PAID.isOpen()).isFalse();
        assertThat(ObligationStatus.openStatuses()).doesNotContain(ObligationStatus.PAID);
    }
}
