package com.moneylens.reconciliation;

import com.moneylens.domain.Bill;
import com.moneylens.domain.BillRepository;
import com.moneylens.domain.LoanPayment;
import com.moneylens.domain.LoanPaymentRepository;
import com.moneylens.domain.ObligationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Time-driven transition SCHEDULED/POSTED -> OVERDUE once the due date has passed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ObligationStatusService {

    private static final Set<ObligationStatus> PENDING = EnumSet.of(ObligationStatus.SCHEDULED, ObligationStatus.POSTED);

    private final BillRepository billRepository;
    private final LoanPaymentRepository loanPaymentRepository;

    /**
     * @return number of obligations moved to OVERDUE
     */
    public int markOverdue(LocalDate today) {
        List<Bill> bills = billRepository.findByStatusInAndDueDateBefore(PENDING, today);
        for (Bill bill : bills) {
            bill.setStatus(ObligationStatus.OVERDUE);
        }
        billRepository.saveAll(bills);
        List<LoanPayment> payments = loanPaymentRepository.findByStatusInAndDueDateBefore(PENDING, today);
        for (LoanPayment payment : payments) {
            payment.setStatus(ObligationStatus.OVERDUE);
        }
        loanPaymentRepository.saveAll(payments);
        int total = bills.size() + payments.size();
        if (total > 0) {
            log.info("Marked {} bill(s) and {} loan payment(s) overdue", bills.size(), payments.size());
        }
        return total;
    }

    public int markOverdue() {
        return markOverdue(LocalDate.now());
    }
}
