package com.moneylens.categorization;

import com.moneylens.categorization.config.CategorizationProperties;
import com.moneylens.categorization.pipeline.ClassificationPipeline;
import com.moneylens.categorization.pipeline.ClassificationRequest;
import com.moneylens.categorization.pipeline.ClassificationResult;
import com.moneylens.categorization.pipeline.OverrideRegistration;
import com.moneylens.domain.ClassificationSource;
import com.moneylens.domain.Transaction;
import com.moneylens.domain.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Applies the classification pipeline to stored transactions and records manual corrections.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionCategorizationService {

    private final TransactionRepository transactionRepository;
    private final ClassificationPipeline classificationPipeline;
    private final CategorizationProperties properties;

    /**
     * Classify one transaction and persist the result on it.
     *
     * @throws CategorizationException TRANSACTION_NOT_FOUND
     */
    public Transaction categorize(String transactionId) {
        Transaction tx = find(transactionId);
        apply(tx, classificationPipeline.classify(ClassificationRequest.of(tx.getDescription(), tx.getMerchant())));
        return transactionRepository.save(tx);
    }

    /**
     * Classify up to batch-size uncategorized transactions. A failure on one transaction is logged and skipped.
     *
     * @return number of transactions categorized
     */
    public int categorizeUncategorized() {
        List<Transaction> batch = transactionRepository.findUncategorized(
                PageRequest.of(0, Math.max(1, properties.getBatchSize()), Sort.by(Sort.Direction.ASC, "date")));
        int done = 0;
        int flagged = 0;
        for (Transaction tx : batch) {
            try {
                ClassificationResult result = classificationPipeline.classify(
                        ClassificationRequest.of(tx.getDescription(), tx.getMerchant()));
                apply(tx, result);
                transactionRepository.save(tx);
                done++;
                if (result.flagged()) {
                    flagged++;
                }
            } catch (RuntimeException e) {
                log.error("Categorization failed for transaction {}", tx.getId(), e);
            }
        }
        if (!batch.isEmpty()) {
            log.info("Categorized {} of {} transaction(s), {} flagged for review", done, batch.size(), flagged);
        }
        return done;
    }

    /**
     * Manual correction: source MANUAL, confidence 1.0, not flagged. Registered with the pipeline
     * (training sample + override counter) before the transaction is written; a rejected sample leaves the
     * transaction unchanged.
     *
     * @throws CategorizationException TRANSACTION_NOT_FOUND, INVALID_SAMPLE
     */
    public OverrideRegistration overrideCategory(String transactionId, String category, String subcategory,
                                                 boolean addTrainingSample) {
        Transaction tx = find(transactionId);
        OverrideRegistration registration = classificationPipeline.registerOverride(
                category, subcategory, tx.getDescription(), addTrainingSample);
        tx.setCategory(category);
        tx.setSubcategory(subcategory);
        tx.setConfidenceScore(1.0);
        tx.setClassificationSource(ClassificationSource.MANUAL);
        tx.setFlagged(false);
        tx.setUpdatedAt(Instant.now());
        transactionRepository.save(tx);
        return registration;
    }

    private Transaction find(String transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> new CategorizationException(CategorizationException.TRANSACTION_NOT_FOUND,
                        "Transaction not found: " + transactionId));
    }

    private static void apply(Transaction tx, ClassificationResult result) {
        tx.setCategory(result.category());
        tx.setSubcategory(result.subcategory());
        tx.setConfidenceScore(result.confidenceScore());
        tx.setClassificationSource(result.source());
        tx.setFlagged(result.flagged());
        tx.setUpdatedAt(Instant.now());
    }
}
