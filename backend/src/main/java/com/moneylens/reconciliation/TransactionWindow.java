package com.moneylens.reconciliation;

import com.moneylens.domain.Obligation;
import com.moneylens.domain.Transaction;
import com.moneylens.domain.TransactionRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Loads the unreconciled transactions that can fall within date tolerance of any of the given obligations.
 */
public final class TransactionWindow {

    private TransactionWindow() {
    }

    public static List<Transaction> load(TransactionRepository repository, Collection<? extends Obligation> obligations,
                                  int dateToleranceDays) {
        LocalDate min = obligations.stream().map(Obligation::getDueDate).filter(Objects::nonNull)
                .min(LocalDate::compareTo).orElse(null);
        LocalDate max = obligations.stream().map(Obligation::getDueDate).filter(Objects::nonNull)
                .max(LocalDate::compareTo).orElse(null);
        if (min == null) {
            return List.of();
        }
        // Between is exclusive on both ends in derived Mongo queries
        return repository.findByReconciledFalseAndDateBetweenOrderByDateAsc(
                min.minusDays(dateToleranceDays + 1L), max.plusDays(dateToleranceDays + 1L));
    }
}
