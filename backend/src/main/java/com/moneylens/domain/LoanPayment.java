package com.moneylens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One scheduled payment of a loan. Kind is decided when the settling transaction is matched.
 */
@Document(collection = "loan_payments")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LoanPayment implements Obligation {

    public static final String REFERENCE_TYPE = "LOAN_PAYMENT";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String loanId;
    private String name;
    private BigDecimal amount;
    private LocalDate dueDate;
    private String accountRef;
    private String category;
    @Indexed
    private ObligationStatus status;
    private String matchedTransactionId;
    private LoanPaymentKind kind;
    private Instant paidAt;

    @Override
    public String referenceType() {
        return REFERENCE_TYPE;
    }
}
