package com.moneylens.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;

/**
 * Persistence for transactions (import layer owns inserts).
 */
public interface TransactionRepository extends MongoRepository<Transaction, String> {

    /** Transactions not yet categorized (category missing or blank). */
    @Query("{ '$or': [ { 'category': null }, { 'category': '' } ] }")
    List<Transaction> findUncategorized(Pageable pageable);

    List<Transaction> findByReconciledFalseAndDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);
}
