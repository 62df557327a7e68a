package com.moneylens.categorization.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.moneylens.categorization.config.CategorizationProperties;
import com.moneylens.domain.CategoryTaxonomy;
import com.moneylens.domain.TrainingSample;
import com.moneylens.domain.TrainingSampleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatisticalClassifierTest {

    @Mock
    TrainingSampleRepository trainingSampleRepository;

    private final ModelCodec codec = new ModelCodec(new ObjectMapper().findAndRegisterModules());
    private final CategorizationProperties properties = new CategorizationProperties();
    private InMemoryModelStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryModelStore();
    }

    private StatisticalClassifier classifier(CategoryTaxonomy taxonomy) {
        return new StatisticalClassifier(trainingSampleRepository, store, codec, taxonomy, properties);
    }

    private static List<TrainingSample> corpus() {
        List<TrainingSample> samples = new ArrayList<>();
        samples.add(sample("ICA Maxi Stockholm", "Food", "Groceries"));
        samples.add(sample("ICA Nara Kista", "Food", "Groceries"));
        samples.add(sample("Coop Konsum Solna", "Food", "Groceries"));
        samples.add(sample("Willys Hemma Solna", "Food", "Groceries"));
        samples.add(sample("Shell tankning Solna", "Transport", "Fuel"));
        samples.add(sample("Circle K tankning bensin", "Transport", "Fuel"));
        samples.add(sample("Preem bensin Kista", "Transport", "Fuel"));
        samples.add(sample("Netflix subscription", "Entertainment", "Streaming"));
        return samples;
    }

    private static TrainingSample sample(String description, String category, String subcategory) {
        return TrainingSample.of(description, category, subcategory, true, Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("a single labeled sample reports failure mentioning the minimum count")
    void singleSampleFails() {
        when(trainingSampleRepository.findAllByOrderByTimestampAsc())
                .thenReturn(List.of(sample("ICA Maxi", "Food", "Groceries")));
        StatisticalClassifier classifier = classifier(CategoryTaxonomy.empty());

        TrainingResult result = classifier.train();

        assertThat(result.success()).isFalse();
        assertThat(result.message()).contains("2").contains("Currently have 1");
        assertThat(classifier.isTrained()).isFalse();
        assertThat(store.saves()).isZero();
    }

    @Test
    @DisplayName("fewer than two qualifying labels reports failure")
    void oneQualifyingLabelFails() {
        when(trainingSampleRepository.findAllByOrderByTimestampAsc()).thenReturn(List.of(
                sample("ICA Maxi", "Food", "Groceries"),
                sample("Coop Konsum", "Food", "Groceries"),
                sample("Shell", "Transport", "Fuel")));

        TrainingResult result = classifier(CategoryTaxonomy.empty()).train();

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo(
                "Need at least 2 categories with 2+ samples each. Currently have 1 valid categories.");
    }

    @Test
    @DisplayName("labels below the per-category minimum are excluded from the fit")
    void smallLabelsExcluded() {
        when(trainingSampleRepository.findAllByOrderByTimestampAsc()).thenReturn(corpus());
        StatisticalClassifier classifier = classifier(CategoryTaxonomy.empty());

        TrainingResult result = classifier.train();

        assertThat(result.success()).isTrue();
        assertThat(result.samplesUsed()).isEqualTo(7);
        assertThat(result.categories()).containsExactly("Food/Groceries", "Transport/Fuel");
        assertThat(result.categoryCounts()).containsEntry("Entertainment/Streaming", 1);
        assertThat(store.saves()).isEqualTo(1);
    }

    @Test
    @DisplayName("trained model predicts a known label with confidence in [0,1]")
    void predicts() {
        when(trainingSampleRepository.findAllByOrderByTimestampAsc()).thenReturn(corpus());
        StatisticalClassifier classifier = classifier(CategoryTaxonomy.empty());
        classifier.train();

        Prediction prediction = classifier.predict("ICA Maxi Haninge", true).orElseThrow();

        assertThat(prediction.label()).isEqualTo("Food/Groceries");
        assertThat(prediction.confidence()).isBetween(0.0, 1.0);
        assertThat(classifier.predict("Circle K bensin", false).orElseThrow().confidence()).isNull();
        assertThat(classifier.predictBatch(List.of("ICA Maxi", " ", "Preem bensin")))
                .extracting(p -> p.map(Prediction::label).orElse(null))
                .containsExactly("Food/Groceries", null, "Transport/Fuel");
    }

    @Test
    @DisplayName("untrained classifier and blank text predict nothing")
    void untrainedPredictsNothing() {
        StatisticalClassifier classifier = classifier(CategoryTaxonomy.empty());

        assertThat(classifier.isTrained()).isFalse();
        assertThat(classifier.predict("ICA Maxi", true)).isEmpty();
        assertThat(classifier.predictBatch(List.of("a", "b"))).allMatch(Optional::isEmpty);
    }

    @Test
    @DisplayName("model survives a restart through the model store")
    void reloadsPersistedModel() {
        when(trainingSampleRepository.findAllByOrderByTimestampAsc()).thenReturn(corpus());
        StatisticalClassifier first = classifier(CategoryTaxonomy.empty());
        first.train();
        Prediction before = first.predict("Shell bensin", true).orElseThrow();

        StatisticalClassifier afterRestart = classifier(CategoryTaxonomy.empty());

        assertThat(afterRestart.isTrained()).isTrue();
        assertThat(afterRestart.predict("Shell bensin", true)).contains(before);
    }

    @Test
    @DisplayName("malformed stored blob leaves the classifier untrained")
    void malformedBlobIgnored() {
        store = new InMemoryModelStore("{not json");

        StatisticalClassifier classifier = classifier(CategoryTaxonomy.empty());

        assertThat(classifier.isTrained()).isFalse();
        assertThat(classifier.predict("ICA", true)).isEmpty();
    }

    @Test
    @DisplayName("samples outside a non-empty taxonomy are not trained")
    void taxonomyFiltersLabels() {
        when(trainingSampleRepository.findAllByOrderByTimestampAsc()).thenReturn(corpus());
        CategoryTaxonomy taxonomy = new CategoryTaxonomy(Map.of(
                "Food", List.of("Groceries"),
                "Entertainment", List.of("Streaming")));

        TrainingResult result = classifier(taxonomy).train();

        assertThat(result.success()).isFalse();
        assertThat(result.categoryCounts()).doesNotContainKey("Transport/Fuel");
    }
}
