package com.moneylens.reconciliation.matcher;

import java.math.BigDecimal;

/**
 * Accepted pairing from one reconciliation pass. Not persisted.
 *
 * @param obligationRef e.g. "BILL:64f0..."
 * @param amountDiff    |transaction amount| - obligation amount, absolute
 */
public record MatchCandidate(String obligationRef, String transactionId, double confidence, BigDecimal amountDiff) {
}
