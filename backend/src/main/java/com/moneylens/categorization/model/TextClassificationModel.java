package com.moneylens.categorization.model;

import java.time.Instant;
import java.util.List;

/**
 * Fitted vectorizer + classifier. Immutable; replaced as a whole on retrain.
 */
public final class TextClassificationModel {

    private final TfidfVectorizer vectorizer;
    private final MultinomialNaiveBayes classifier;
    private final double alpha;
    private final int samplesUsed;
    private final Instant trainedAt;

    public TextClassificationModel(TfidfVectorizer vectorizer, MultinomialNaiveBayes classifier,
                                   double alpha, int samplesUsed, Instant trainedAt) {
        this.vectorizer = vectorizer;
        this.classifier = classifier;
        this.alpha = alpha;
        this.samplesUsed = samplesUsed;
        this.trainedAt = trainedAt;
    }

    public Prediction predict(String text, boolean returnProbability) {
        double[] proba = classifier.predictProba(vectorizer.transform(text));
        int best = 0;
        for (int c = 1; c < proba.length; c++) {
            if (proba[c] > proba[best]) {
                best = c;
            }
        }
        Double confidence = returnProbability ? Math.round(proba[best] * 1000.0) / 1000.0 : null;
        return new Prediction(classifier.getClasses().get(best), confidence);
    }

    public List<String> getLabels() {
        return classifier.getClasses();
    }

    public TfidfVectorizer getVectorizer() {
        return vectorizer;
    }

    public MultinomialNaiveBayes getClassifier() {
        return classifier;
    }

    public double getAlpha() {
        return alpha;
    }

    public int getSamplesUsed() {
        return samplesUsed;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }
}
