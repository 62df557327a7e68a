package com.moneylens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for loans.
 */
public interface LoanRepository extends MongoRepository<Loan, String> {
}
