package com.moneylens.categorization.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;

/**
 * JSON encoding of a fitted model: vocabulary, IDF weights and classifier parameters.
 */
@Component
@RequiredArgsConstructor
public class ModelCodec {

    public static final String FORMAT = "tfidf-multinomial-nb/v1";

    private final ObjectMapper objectMapper;

    public String encode(TextClassificationModel model) {
        MultinomialNaiveBayes nb = model.getClassifier();
        ModelState state = new ModelState(
                FORMAT,
                model.getVectorizer().getVocabulary(),
                model.getVectorizer().getIdf(),
                nb.getClasses(),
                nb.getClassLogPrior(),
                nb.getFeatureLogProb(),
                model.getAlpha(),
                model.getSamplesUsed(),
                model.getTrainedAt());
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode classifier model", e);
        }
    }

    /**
     * @throws UncheckedIOException     when the blob is not valid JSON for this format
     * @throws IllegalArgumentException when dimensions are inconsistent or the format is unknown
     */
    public TextClassificationModel decode(String blob) {
        ModelState state;
        try {
            state = objectMapper.readValue(blob, ModelState.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot decode classifier model", e);
        }
        if (!FORMAT.equals(state.format())) {
            throw new IllegalArgumentException("Unsupported model format: " + state.format());
        }
        TfidfVectorizer vectorizer = new TfidfVectorizer(state.vocabulary(), state.idf());
        for (double[] row : state.featureLogProb()) {
            if (row.length != vectorizer.size()) {
                throw new IllegalArgumentException("featureLogProb width " + row.length + " != vocabulary " + vectorizer.size());
            }
        }
        MultinomialNaiveBayes nb = new MultinomialNaiveBayes(state.classes(), state.classLogPrior(), state.featureLogProb());
        return new TextClassificationModel(vectorizer, nb, state.alpha(), state.samplesUsed(), state.trainedAt());
    }

    record ModelState(
            String format,
            List<String> vocabulary,
            double[] idf,
            List<String> classes,
            double[] classLogPrior,
            double[][] featureLogProb,
            double alpha,
            int samplesUsed,
            Instant trainedAt
    ) {
    }
}
