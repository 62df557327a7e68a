package com.moneylens.categorization.training;

import com.moneylens.categorization.config.CategorizationProperties;
import com.moneylens.categorization.model.StatisticalClassifier;
import com.moneylens.categorization.model.TrainingResult;
import com.moneylens.domain.RetrainingAuditEntry;
import com.moneylens.domain.RetrainingAuditRepository;
import com.moneylens.domain.TrainingSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Retrains the statistical classifier from the full corpus and appends one audit entry per run.
 * {@link #run()} never throws; every failure is a result with success=false.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrainingService {

    private final TrainingSampleRepository trainingSampleRepository;
    private final RetrainingAuditRepository retrainingAuditRepository;
    private final StatisticalClassifier statisticalClassifier;
    private final CategorizationProperties properties;

    public boolean shouldRetrain() {
        try {
            return trainingSampleRepository.count() >= properties.getRetraining().getTriggerThreshold();
        } catch (RuntimeException e) {
            log.error("Could not check retraining threshold", e);
            return false;
        }
    }

    public RetrainingResult run() {
        Instant startedAt = Instant.now();
        String modelType = properties.getModel().getModelType();
        int minSamples = properties.getRetraining().getMinSamples();
        RetrainingResult result;
        try {
            long total = trainingSampleRepository.count();
            if (total < minSamples) {
                result = new RetrainingResult(false, startedAt, modelType, 0, 0.0,
                        "Insufficient training data: " + total + " samples (need at least " + minSamples + ")");
                log.warn(result.message());
            } else {
                TrainingResult training = statisticalClassifier.train();
                if (!training.success()) {
                    result = new RetrainingResult(false, startedAt, modelType, 0, 0.0,
                            "Model training failed: " + training.message());
                    log.warn(result.message());
                } else {
                    double accuracy = (double) training.samplesUsed() / Math.max(total, 1);
                    result = new RetrainingResult(true, startedAt, modelType, training.samplesUsed(), accuracy,
                            "Successfully retrained model with " + training.samplesUsed() + " samples");
                    log.info("Retraining complete: {} sample(s) of {}, {} categories",
                            training.samplesUsed(), total, training.categories().size());
                }
            }
        } catch (RuntimeException e) {
            result = new RetrainingResult(false, startedAt, modelType, 0, 0.0, "Retraining error: " + e.getMessage());
            log.error("Retraining failed", e);
        }
        audit(result);
        return result;
    }

    private void audit(RetrainingResult result) {
        RetrainingAuditEntry entry = new RetrainingAuditEntry();
        entry.setTimestamp(result.timestamp());
        entry.setModelType(result.modelType());
        entry.setSamplesUsed(result.samplesUsed());
        entry.setAccuracy(result.accuracy());
        entry.setSuccess(result.success());
        entry.setMessage(result.message());
        try {
            retrainingAuditRepository.save(entry);
        } catch (RuntimeException e) {
            log.error("Failed to write retraining audit entry", e);
        }
    }

    public RetrainingStats getStats() {
        Optional<RetrainingAuditEntry> last = retrainingAuditRepository.findFirstByOrderByTimestampDesc();
        return new RetrainingStats(
                properties.getRetraining().getTriggerThreshold(),
                properties.getModel().getModelType(),
                shouldRetrain(),
                trainingSampleRepository.count(),
                last.map(RetrainingAuditEntry::getTimestamp).orElse(null),
                last.map(RetrainingAuditEntry::getAccuracy).orElse(null),
                last.map(RetrainingAuditEntry::getSamplesUsed).orElse(null),
                last.map(RetrainingAuditEntry::isSuccess).orElse(null));
    }
}
