package com.moneylens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the serialized classifier model.
 */
public interface ClassifierModelRepository extends MongoRepository<ClassifierModelDocument, String> {
}
