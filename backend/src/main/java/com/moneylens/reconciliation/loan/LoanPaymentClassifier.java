package com.moneylens.reconciliation.loan;

import com.moneylens.common.TextNormalizer;
import com.moneylens.domain.LoanPaymentKind;

import java.util.List;

/**
 * Interest vs principal by keyword in the transaction description (accent- and case-insensitive).
 */
public class LoanPaymentClassifier {

    private final List<String> interestKeywords;

    public LoanPaymentClassifier(List<String> interestKeywords) {
        this.interestKeywords = interestKeywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> TextNormalizer.normalize(k.strip()))
                .toList();
    }

    public LoanPaymentKind classify(String description) {
        String text = TextNormalizer.normalize(description);
        for (String keyword : interestKeywords) {
            if (text.contains(keyword)) {
                return LoanPaymentKind.INTEREST;
            }
        }
        return LoanPaymentKind.PRINCIPAL;
    }
}
