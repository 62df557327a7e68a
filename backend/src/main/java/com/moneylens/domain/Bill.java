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
 * Bill to be paid (e.g. electricity, insurance). Created by the bills collaborator (manual entry or PDF import).
 */
@Document(collection = "bills")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Bill implements Obligation {

    public static final String REFERENCE_TYPE = "BILL";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    private String description;
    private BigDecimal amount;
    private LocalDate dueDate;
    private String accountRef;
    private String category;
    @Indexed
    private ObligationStatus status;
    private String matchedTransactionId;
    private Instant paidAt;
    private Instant createdAt;

    @Override
    public String referenceType() {
        return REFERENCE_TYPE;
    }
}
