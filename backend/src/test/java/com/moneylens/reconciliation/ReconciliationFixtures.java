package com.moneylens.reconciliation;

import com.moneylens.domain.Bill;
import com.moneylens.domain.LoanPayment;
import com.moneylens.domain.ObligationStatus;
import com.moneylens.domain.Transaction;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Builders for obligations and transactions used across reconciliation tests.
 */
public final class ReconciliationFixtures {

    public static final String ACCOUNT = "8327-9 123 456 789-0";

    private ReconciliationFixtures() {
    }

    public static Bill bill(String id, String name, String amount, LocalDate dueDate) {
        Bill b = new Bill();
        b.setId(id);
        b.setName(name);
        b.setAmount(new BigDecimal(amount));
        b.setDueDate(dueDate);
        b.setStatus(ObligationStatus.SCHEDULED);
        return b;
    }

    public static LoanPayment loanPayment(String id, String loanId, String name, String amount, LocalDate dueDate) {
        LoanPayment p = new LoanPayment();
        p.setId(id);
        p.setLoanId(loanId);
        p.setName(name);
        p.setAmount(new BigDecimal(amount));
        p.setDueDate(dueDate);
        p.setStatus(ObligationStatus.SCHEDULED);
        return p;
    }

    public static Transaction tx(String id, String description, String amount, LocalDate date) {
        Transaction t = new Transaction();
        t.setId(id);
        t.setDescription(description);
        t.setAmount(new BigDecimal(amount));
        t.setDate(date);
        return t;
    }
}
