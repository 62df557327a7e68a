package com.moneylens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Persistence for bills.
 */
public interface BillRepository extends MongoRepository<Bill, String> {

    List<Bill> findByStatusInAndDueDateBefore(Collection<ObligationStatus> statuses, LocalDate date);

    List<Bill> findByStatusInAndMatchedTransactionIdIsNullOrderByDueDateAsc(Collection<ObligationStatus> statuses);
}
