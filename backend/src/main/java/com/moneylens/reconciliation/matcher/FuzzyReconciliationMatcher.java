package com.moneylens.reconciliation.matcher;

import com.moneylens.domain.Obligation;
import com.moneylens.domain.ObligationStatus;
import com.moneylens.domain.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One reconciliation pass: pairs open obligations with unreconciled transactions.
 * Obligations are processed in input order; each takes the highest-scoring eligible transaction
 * (first in input order on ties) if it reaches the acceptance threshold. A transaction is linked to at most one
 * obligation per pass. Accepted pairs are applied in place: obligation PAID + linked, transaction reconciled.
 */
@Component
@Slf4j
public class FuzzyReconciliationMatcher {

    public List<MatchCandidate> reconcile(Collection<? extends Obligation> obligations,
                                          List<Transaction> transactions,
                                          ReconciliationOptions options) {
        List<MatchCandidate> accepted = new ArrayList<>();
        if (obligations == null || obligations.isEmpty() || transactions == null || transactions.isEmpty()) {
            return accepted;
        }
        Set<String> claimed = new HashSet<>();
        for (Obligation obligation : obligations) {
            if (!obligation.isOpenForMatching() || obligation.getAmount() == null || obligation.getDueDate() == null) {
                continue;
            }
            Transaction best = null;
            double bestScore = -1.0;
            for (Transaction tx : transactions) {
                if (!eligible(obligation, tx, claimed, options.dateToleranceDays())) {
                    continue;
                }
                double score = MatchScorer.score(obligation, tx, options.amountTolerancePercent());
                if (score > bestScore) {
                    bestScore = score;
                    best = tx;
                }
            }
            if (best == null) {
                log.debug("No eligible transaction for {}", obligation.reference());
                continue;
            }
            if (bestScore < options.acceptanceThreshold()) {
                log.debug("Best match for {} is {} at {}, below threshold {}", obligation.reference(),
                        best.getId(), bestScore, options.acceptanceThreshold());
                continue;
            }
            BigDecimal diff = MatchScorer.amountDiff(obligation.getAmount(), best.getAmount());
            obligation.setStatus(ObligationStatus.PAID);
            obligation.setMatchedTransactionId(best.getId());
            best.markReconciled(obligation.reference());
            claimed.add(identity(best));
            accepted.add(new MatchCandidate(obligation.reference(), best.getId(), bestScore, diff));
            log.info("Matched {} with transaction {} (confidence {})", obligation.reference(), best.getId(), bestScore);
        }
        return accepted;
    }

    public List<MatchCandidate> reconcile(Collection<? extends Obligation> obligations, List<Transaction> transactions) {
        return reconcile(obligations, transactions, ReconciliationOptions.defaults());
    }

    private static boolean eligible(Obligation obligation, Transaction tx, Set<String> claimed, int dateToleranceDays) {
        if (tx.isReconciled() || tx.getMatchedObligationRef() != null || claimed.contains(identity(tx))) {
            return false;
        }
        if (tx.getAmount() == null || tx.getDate() == null || tx.getAmount().signum() == 0) {
            return false;
        }
        if (tx.isExpense() != obligation.isExpense()) {
            return false;
        }
        return withinDays(obligation.getDueDate(), tx.getDate(), dateToleranceDays);
    }

    static boolean withinDays(LocalDate a, LocalDate b, int days) {
        return Math.abs(ChronoUnit.DAYS.between(a, b)) <= days;
    }

    /** Id when persisted, object identity otherwise. */
    private static String identity(Transaction tx) {
        return tx.getId() != null ? tx.getId() : "@" + System.identityHashCode(tx);
    }
}
