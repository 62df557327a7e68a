package com.moneylens.domain;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Imported bank transaction. Written by the import layer; categorization fields are filled by the
 * classification pipeline, reconciliation fields by the reconciliation matcher.
 * Amount is signed: negative = expense.
 */
@Document(collection = "transactions")
@CompoundIndex(name = "reconciled_date", def = "{'reconciled': 1, 'date': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Transaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String description;
    private String merchant;
    private BigDecimal amount;
    private LocalDate date;
    private String accountRef;

    @Indexed
    private String category;
    private String subcategory;
    private Double confidenceScore;
    private ClassificationSource classificationSource;
    /** Needs human review (default bucket or marginal model/semantic hit). */
    private boolean flagged;

    /** Set once; see {@link #markReconciled(String)}. */
    @Setter(AccessLevel.NONE)
    private String matchedObligationRef;
    @Setter(AccessLevel.NONE)
    private boolean reconciled;

    private Instant importedAt;
    private Instant updatedAt;

    /**
     * Link this transaction to the obligation it settles. A transaction settles at most one obligation.
     *
     * @throws IllegalStateException when already linked
     */
    public void markReconciled(String obligationRef) {
        if (matchedObligationRef != null) {
            throw new IllegalStateException("Transaction " + id + " already reconciled with " + matchedObligationRef);
        }
        this.matchedObligationRef = obligationRef;
        this.reconciled = true;
    }

    public boolean isExpense() {
        return amount != null && amount.signum() < 0;
    }

    public boolean isUncategorized() {
        return category == null || category.isBlank();
    }
}
