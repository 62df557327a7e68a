package com.moneylens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Loan with outstanding balance. Scheduled payments live in loan_payments; matched repayments are recorded here.
 */
@Document(collection = "loans")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Loan {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    private String accountRef;
    private BigDecimal principal;
    private BigDecimal currentBalance;
    /** Annual rate in percent, e.g. 3.5. */
    private BigDecimal interestRate;
    private LoanStatus status;
    private List<Repayment> repayments = new ArrayList<>();
    private Instant createdAt;

    public enum LoanStatus {
        ACTIVE,
        PAID_OFF
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Repayment {
        private LocalDate date;
        private BigDecimal amount;
        private LoanPaymentKind kind;
        private String transactionId;
        private String loanPaymentId;
        private Instant recordedAt;
    }
}
