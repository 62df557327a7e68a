package com.moneylens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Stored classification rules, in creation order.
 */
public interface ClassificationRuleRepository extends MongoRepository<ClassificationRule, String> {

    List<ClassificationRule> findAllByOrderByCreatedAtAsc();

    long deleteByAiGeneratedTrue();
}
