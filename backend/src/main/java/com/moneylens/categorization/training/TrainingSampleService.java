package com.moneylens.categorization.training;

import com.moneylens.categorization.CategorizationException;
import com.moneylens.categorization.CategoryLabel;
import com.moneylens.categorization.config.CategorizationProperties;
import com.moneylens.domain.CategoryTaxonomy;
import com.moneylens.domain.TrainingSample;
import com.moneylens.domain.TrainingSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only training corpus: add, inspect, clear.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingSampleService {

    private final TrainingSampleRepository trainingSampleRepository;
    private final CategorizationProperties properties;
    private final CategoryTaxonomy taxonomy;

    /**
     * @throws CategorizationException INVALID_SAMPLE when description or category is blank
     */
    public TrainingSample addSample(String description, String category, String subcategory, boolean manual) {
        if (description == null || description.isBlank() || category == null || category.isBlank()) {
            throw new CategorizationException(CategorizationException.INVALID_SAMPLE,
                    "Training sample needs a description and a category");
        }
        TrainingSample saved = trainingSampleRepository.save(TrainingSample.of(
                description.strip(), category.strip(), subcategory == null ? null : subcategory.strip(),
                manual, Instant.now()));
        log.debug("Training sample added ({}): {} -> {}/{}", manual ? "manual" : "imported",
                saved.getDescription(), saved.getCategory(), saved.getSubcategory());
        return saved;
    }

    public List<TrainingSample> samples() {
        return trainingSampleRepository.findAllByOrderByTimestampAsc();
    }

    public List<TrainingSample> manualSamples() {
        return trainingSampleRepository.findByManualTrueOrderByTimestampAsc();
    }

    public long count() {
        return trainingSampleRepository.count();
    }

    /**
     * Counts per training label ("Category/Subcategory"), over the samples the classifier would train on:
     * blank descriptions and categories outside the taxonomy are left out of the label counts.
     */
    public TrainingStats getStats() {
        List<TrainingSample> all = samples();
        Map<String, Integer> counts = new LinkedHashMap<>();
        long manual = 0;
        for (TrainingSample s : all) {
            if (s.isManual()) {
                manual++;
            }
            String description = s.getDescription() == null ? "" : s.getDescription().strip();
            String category = s.getCategory() == null ? "" : s.getCategory().strip();
            if (description.isEmpty() || category.isEmpty() || !taxonomy.allows(category)) {
                continue;
            }
            String subcategory = s.getSubcategory() == null ? null : s.getSubcategory().strip();
            counts.merge(new CategoryLabel(category, subcategory).toTrainingLabel(), 1, Integer::sum);
        }
        int minPerCategory = properties.getModel().getMinSamplesPerCategory();
        long qualifying = counts.values().stream().filter(c -> c >= minPerCategory).count();
        return new TrainingStats(all.size(), manual, counts, qualifying >= 2, minPerCategory);
    }

    public void clear() {
        long removed = trainingSampleRepository.count();
        trainingSampleRepository.deleteAll();
        log.info("Training corpus cleared ({} sample(s))", removed);
    }
}
