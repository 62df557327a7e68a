package com.moneylens.reconciliation;

import com.moneylens.reconciliation.matcher.MatchCandidate;

import java.util.List;

/**
 * Result of one reconciliation run over stored obligations.
 */
public record ReconciliationReport(int obligationsConsidered, int transactionsConsidered, List<MatchCandidate> matches) {

    public int unmatched() {
        return obligationsConsidered - matches.size();
    }
}
