package com.moneylens.categorization.model;

import com.moneylens.categorization.CategoryLabel;
import com.moneylens.categorization.config.CategorizationProperties;
import com.moneylens.domain.CategoryTaxonomy;
import com.moneylens.domain.TrainingSample;
import com.moneylens.domain.TrainingSampleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Trainable text classifier over the training corpus (TF-IDF unigrams+bigrams, multinomial naive Bayes).
 * The fitted model is persisted through {@link ModelStore} and reloaded on construction, so predictions are
 * available after a restart without retraining. Untrained = every prediction is empty.
 */
@Component
@Slf4j
public class StatisticalClassifier {

    private static final int MIN_TOTAL_SAMPLES = 2;
    private static final int MIN_CATEGORIES = 2;

    private final TrainingSampleRepository trainingSampleRepository;
    private final ModelStore modelStore;
    private final ModelCodec modelCodec;
    private final CategoryTaxonomy taxonomy;
    private final CategorizationProperties.ModelProperties modelProperties;

    private volatile TextClassificationModel model;

    public StatisticalClassifier(TrainingSampleRepository trainingSampleRepository,
                                 ModelStore modelStore,
                                 ModelCodec modelCodec,
                                 CategoryTaxonomy taxonomy,
                                 CategorizationProperties properties) {
        this.trainingSampleRepository = trainingSampleRepository;
        this.modelStore = modelStore;
        this.modelCodec = modelCodec;
        this.taxonomy = taxonomy;
        this.modelProperties = properties.getModel();
        this.model = loadStoredModel();
    }

    private TextClassificationModel loadStoredModel() {
        try {
            Optional<String> blob = modelStore.load();
            if (blob.isEmpty()) {
                log.info("No stored classifier model; classifier untrained until first training");
                return null;
            }
            TextClassificationModel loaded = modelCodec.decode(blob.get());
            log.info("Loaded classifier model: {} label(s), {} term(s), trained {}",
                    loaded.getLabels().size(), loaded.getVectorizer().size(), loaded.getTrainedAt());
            return loaded;
        } catch (RuntimeException e) {
            log.warn("Stored classifier model unavailable, starting untrained: {}", e.getMessage());
            return null;
        }
    }

    public TrainingResult train() {
        return train(modelProperties.getMinSamplesPerCategory());
    }

    /**
     * Fit a new model on the whole corpus. Labels with fewer than {@code minSamplesPerCategory} samples are left
     * out of this fit. Reports failure (no exception) when fewer than 2 samples or 2 qualifying labels exist;
     * the previous model then stays in place.
     */
    public TrainingResult train(int minSamplesPerCategory) {
        List<String> descriptions = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (TrainingSample sample : trainingSampleRepository.findAllByOrderByTimestampAsc()) {
            String desc = sample.getDescription() == null ? "" : sample.getDescription().strip();
            String category = sample.getCategory() == null ? "" : sample.getCategory().strip();
            if (desc.isEmpty() || category.isEmpty()) {
                continue;
            }
            if (!taxonomy.allows(category)) {
                log.debug("Skipping sample with category outside taxonomy: {}", category);
                continue;
            }
            descriptions.add(desc);
            labels.add(new CategoryLabel(category, sample.getSubcategory() == null ? null : sample.getSubcategory().strip())
                    .toTrainingLabel());
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String label : labels) {
            counts.merge(label, 1, Integer::sum);
        }

        if (descriptions.size() < MIN_TOTAL_SAMPLES) {
            return TrainingResult.failure("Need at least " + MIN_TOTAL_SAMPLES + " training samples. Currently have "
                    + descriptions.size() + ".", List.of(), counts);
        }

        TreeSet<String> valid = new TreeSet<>();
        counts.forEach((label, count) -> {
            if (count >= minSamplesPerCategory) {
                valid.add(label);
            }
        });
        if (valid.size() < MIN_CATEGORIES) {
            return TrainingResult.failure("Need at least " + MIN_CATEGORIES + " categories with " + minSamplesPerCategory
                    + "+ samples each. Currently have " + valid.size() + " valid categories.", List.copyOf(valid), counts);
        }

        List<String> trainDescriptions = new ArrayList<>();
        List<String> trainLabels = new ArrayList<>();
        for (int i = 0; i < descriptions.size(); i++) {
            if (valid.contains(labels.get(i))) {
                trainDescriptions.add(descriptions.get(i));
                trainLabels.add(labels.get(i));
            }
        }

        TfidfVectorizer vectorizer = TfidfVectorizer.fit(trainDescriptions, modelProperties.getMaxFeatures());
        if (vectorizer.size() == 0) {
            return TrainingResult.failure("Training descriptions contain no usable terms.", List.copyOf(valid), counts);
        }
        double[][] x = new double[trainDescriptions.size()][];
        for (int i = 0; i < trainDescriptions.size(); i++) {
            x[i] = vectorizer.transform(trainDescriptions.get(i));
        }
        MultinomialNaiveBayes nb = MultinomialNaiveBayes.fit(x, trainLabels, modelProperties.getAlpha());
        TextClassificationModel fitted = new TextClassificationModel(vectorizer, nb, modelProperties.getAlpha(),
                trainDescriptions.size(), Instant.now());

        modelStore.save(modelCodec.encode(fitted));
        this.model = fitted;

        List<String> categories = List.copyOf(valid);
        log.info("Classifier trained on {} sample(s) across {} categories ({} term(s))",
                trainDescriptions.size(), categories.size(), vectorizer.size());
        return new TrainingResult(true,
                "Model trained successfully with " + trainDescriptions.size() + " samples across "
                        + categories.size() + " categories.",
                trainDescriptions.size(), categories, counts);
    }

    /**
     * @return predicted training label ("Category/Subcategory"), empty when untrained or the text is blank
     */
    public Optional<Prediction> predict(String text, boolean returnProbability) {
        TextClassificationModel current = model;
        if (current == null || text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(current.predict(text, returnProbability));
    }

    public Optional<Prediction> predict(String text) {
        return predict(text, false);
    }

    public List<Optional<Prediction>> predictBatch(List<String> texts) {
        List<Optional<Prediction>> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(predict(text, true));
        }
        return out;
    }

    public boolean isTrained() {
        return model != null;
    }

    public ModelInfo getModelInfo() {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        List<TrainingSample> samples = trainingSampleRepository.findAllByOrderByTimestampAsc();
        for (TrainingSample s : samples) {
            if (s.getCategory() != null && !s.getCategory().isBlank()) {
                distribution.merge(s.getCategory(), 1, Integer::sum);
            }
        }
        TextClassificationModel current = model;
        return new ModelInfo(
                current != null,
                samples.size(),
                current != null ? current.getLabels() : List.of(),
                distribution,
                current != null ? current.getTrainedAt() : null);
    }
}
