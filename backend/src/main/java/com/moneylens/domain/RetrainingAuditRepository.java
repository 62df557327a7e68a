package com.moneylens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Retraining audit trail.
 */
public interface RetrainingAuditRepository extends MongoRepository<RetrainingAuditEntry, String> {

    Optional<RetrainingAuditEntry> findFirstByOrderByTimestampDesc();
}
