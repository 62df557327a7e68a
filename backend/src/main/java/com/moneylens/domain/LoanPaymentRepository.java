package com.moneylens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Persistence for scheduled loan payments.
 */
public interface LoanPaymentRepository extends MongoRepository<LoanPayment, String> {

    List<LoanPayment> findByStatusInAndMatchedTransactionIdIsNullOrderByDueDateAsc(Collection<ObligationStatus> statuses);

    List<LoanPayment> findByStatusInAndDueDateBefore(Collection<ObligationStatus> statuses, LocalDate date);
}
