package com.moneylens.categorization.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCodecTest {

    private final ModelCodec codec = new ModelCodec(new ObjectMapper().findAndRegisterModules());

    private static TextClassificationModel model() {
        List<String> docs = List.of("ica maxi", "coop konsum", "shell bensin", "preem bensin");
        TfidfVectorizer v = TfidfVectorizer.fit(docs, 500);
        double[][] x = docs.stream().map(v::transform).toArray(double[][]::new);
        MultinomialNaiveBayes nb = MultinomialNaiveBayes.fit(x, List.of("Food", "Food", "Fuel", "Fuel"), 0.1);
        return new TextClassificationModel(v, nb, 0.1, 4, Instant.parse("2025-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("decoded model keeps vocabulary, labels and predictions")
    void decodePreservesModel() {
        TextClassificationModel original = model();

        TextClassificationModel decoded = codec.decode(codec.encode(original));

        assertThat(decoded.getVectorizer().getVocabulary()).isEqualTo(original.getVectorizer().getVocabulary());
        assertThat(decoded.getLabels()).containsExactly("Food", "Fuel");
        assertThat(decoded.getTrainedAt()).isEqualTo(original.getTrainedAt());
        assertThat(decoded.predict("preem", true)).isEqualTo(original.predict("preem", true));
    }

    @Test
    @DisplayName("unknown format and broken JSON are rejected")
    void rejectsBadBlobs() {
        String blob = codec.encode(model()).replace(ModelCodec.FORMAT, "pickle/v0");

        assertThatThrownBy(() -> codec.decode(blob)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode("[]")).isInstanceOf(UncheckedIOException.class);
    }
}
