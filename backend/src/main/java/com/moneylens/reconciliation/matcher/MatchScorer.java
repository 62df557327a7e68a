package com.moneylens.reconciliation.matcher;

import com.moneylens.common.AccountNumbers;
import com.moneylens.common.TextNormalizer;
import com.moneylens.domain.Obligation;
import com.moneylens.domain.Transaction;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Set;

/**
 * Weighted match confidence between an obligation and a transaction, clamped to [0,1].
 * Weights are kept in tenths so sums compare exactly against thresholds.
 * <ul>
 *   <li>account: same normalized account number +0.4</li>
 *   <li>amount: exact (&lt; 0.01) +0.5, within tolerance % +0.3, within 10% +0.2</li>
 *   <li>description: name/description substring +0.3, 2+ shared words +0.2, 1 shared word +0.1</li>
 *   <li>category: equal (case-insensitive) +0.1</li>
 * </ul>
 */
public final class MatchScorer {

    static final int ACCOUNT_POINTS = 4;
    static final int AMOUNT_EXACT_POINTS = 5;
    static final int AMOUNT_TOLERANCE_POINTS = 3;
    static final int AMOUNT_APPROX_POINTS = 2;
    static final int DESCRIPTION_SUBSTRING_POINTS = 3;
    static final int DESCRIPTION_MULTI_WORD_POINTS = 2;
    static final int DESCRIPTION_SINGLE_WORD_POINTS = 1;
    static final int CATEGORY_POINTS = 1;
    private static final int MAX_POINTS = 10;

    private static final BigDecimal EXACT_AMOUNT_EPSILON = new BigDecimal("0.01");
    private static final BigDecimal APPROX_RATIO = new BigDecimal("0.10");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MatchScorer() {
    }

    public static double score(Obligation obligation, Transaction transaction, double amountTolerancePercent) {
        int points = accountPoints(obligation, transaction)
                + amountPoints(obligation.getAmount(), transaction.getAmount(), amountTolerancePercent)
                + descriptionPoints(obligation.getName(), transaction.getDescription())
                + categoryPoints(obligation.getCategory(), transaction.getCategory());
        return Math.min(points, MAX_POINTS) / 10.0;
    }

    static int accountPoints(Obligation obligation, Transaction transaction) {
        return AccountNumbers.sameAccount(obligation.getAccountRef(), transaction.getAccountRef()) ? ACCOUNT_POINTS : 0;
    }

    static int amountPoints(BigDecimal expected, BigDecimal actual, double tolerancePercent) {
        if (expected == null || actual == null) {
            return 0;
        }
        BigDecimal diff = amountDiff(expected, actual);
        if (diff.compareTo(EXACT_AMOUNT_EPSILON) < 0) {
            return AMOUNT_EXACT_POINTS;
        }
        BigDecimal base = expected.abs();
        if (base.signum() == 0) {
            return 0;
        }
        BigDecimal ratio = diff.divide(base, MathContext.DECIMAL64);
        if (ratio.compareTo(BigDecimal.valueOf(tolerancePercent).divide(HUNDRED, MathContext.DECIMAL64)) < 0) {
            return AMOUNT_TOLERANCE_POINTS;
        }
        if (ratio.compareTo(APPROX_RATIO) < 0) {
            return AMOUNT_APPROX_POINTS;
        }
        return 0;
    }

    static int descriptionPoints(String name, String description) {
        if (name == null || name.isBlank() || description == null || description.isBlank()) {
            return 0;
        }
        String n = name.strip().toLowerCase(Locale.ROOT);
        String d = description.strip().toLowerCase(Locale.ROOT);
        if (d.contains(n) || n.contains(d)) {
            return DESCRIPTION_SUBSTRING_POINTS;
        }
        Set<String> shared = TextNormalizer.whitespaceTokens(n);
        shared.retainAll(TextNormalizer.whitespaceTokens(d));
        if (shared.size() >= 2) {
            return DESCRIPTION_MULTI_WORD_POINTS;
        }
        return shared.size() == 1 ? DESCRIPTION_SINGLE_WORD_POINTS : 0;
    }

    static int categoryPoints(String obligationCategory, String transactionCategory) {
        if (obligationCategory == null || obligationCategory.isBlank()
                || transactionCategory == null || transactionCategory.isBlank()) {
            return 0;
        }
        return obligationCategory.strip().equalsIgnoreCase(transactionCategory.strip()) ? CATEGORY_POINTS : 0;
    }

    /** Absolute difference between the amount due and the transaction's magnitude. */
    public static BigDecimal amountDiff(BigDecimal expected, BigDecimal actual) {
        return actual.abs().subtract(expected.abs()).abs();
    }
}
