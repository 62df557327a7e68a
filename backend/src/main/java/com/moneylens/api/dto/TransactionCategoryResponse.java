package com.moneylens.api.dto;

import com.moneylens.domain.Transaction;

/**
 * Categorization fields of a stored transaction.
 */
public record TransactionCategoryResponse(
        String transactionId,
        String description,
        String category,
        String subcategory,
        Double confidenceScore,
        String source,
        boolean flagged
) {

    public static TransactionCategoryResponse from(Transaction tx) {
        return new TransactionCategoryResponse(tx.getId(), tx.getDescription(), tx.getCategory(), tx.getSubcategory(),
                tx.getConfidenceScore(),
                tx.getClassificationSource() != null ? tx.getClassificationSource().code() : null,
                tx.isFlagged());
    }
}
