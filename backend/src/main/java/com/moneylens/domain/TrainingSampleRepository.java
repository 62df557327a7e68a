package com.moneylens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Append-only training corpus.
 */
public interface TrainingSampleRepository extends MongoRepository<TrainingSample, String> {

    List<TrainingSample> findAllByOrderByTimestampAsc();

    List<TrainingSample> findByManualTrueOrderByTimestampAsc();
}
