package com.moneylens.categorization.model;

import com.moneylens.common.TextNormalizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bag of unigrams and bigrams weighted by smoothed TF-IDF, rows L2-normalized.
 * Vocabulary is capped to the {@code maxFeatures} most frequent terms of the training corpus
 * and indexed in alphabetical order.
 */
public final class TfidfVectorizer {

    private final List<String> vocabulary;
    private final double[] idf;
    private final Map<String, Integer> index;

    TfidfVectorizer(List<String> vocabulary, double[] idf) {
        if (vocabulary.size() != idf.length) {
            throw new IllegalArgumentException("vocabulary/idf size mismatch: " + vocabulary.size() + " vs " + idf.length);
        }
        this.vocabulary = List.copyOf(vocabulary);
        this.idf = idf.clone();
        this.index = new HashMap<>();
        for (int i = 0; i < this.vocabulary.size(); i++) {
            index.put(this.vocabulary.get(i), i);
        }
    }

    /**
     * Learn vocabulary and IDF weights. idf(t) = ln((1 + n) / (1 + df(t))) + 1.
     */
    public static TfidfVectorizer fit(List<String> documents, int maxFeatures) {
        Map<String, Integer> termFrequency = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (String doc : documents) {
            List<String> terms = terms(doc);
            Set<String> seen = new HashSet<>();
            for (String term : terms) {
                termFrequency.merge(term, 1, Integer::sum);
                if (seen.add(term)) {
                    documentFrequency.merge(term, 1, Integer::sum);
                }
            }
        }
        List<String> selected = new ArrayList<>(termFrequency.keySet());
        selected.sort((a, b) -> {
            int byFrequency = Integer.compare(termFrequency.get(b), termFrequency.get(a));
            return byFrequency != 0 ? byFrequency : a.compareTo(b);
        });
        if (maxFeatures > 0 && selected.size() > maxFeatures) {
            selected = new ArrayList<>(selected.subList(0, maxFeatures));
        }
        selected.sort(String::compareTo);

        int n = documents.size();
        double[] idf = new double[selected.size()];
        for (int i = 0; i < selected.size(); i++) {
            int df = documentFrequency.get(selected.get(i));
            idf[i] = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
        }
        return new TfidfVectorizer(selected, idf);
    }

    /**
     * Unigrams followed by bigrams ("a b") over normalized word tokens.
     */
    static List<String> terms(String document) {
        List<String> tokens = TextNormalizer.wordTokens(document);
        List<String> terms = new ArrayList<>(tokens.size() * 2);
        terms.addAll(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            terms.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return terms;
    }

    public double[] transform(String document) {
        double[] v = new double[vocabulary.size()];
        for (String term : terms(document)) {
            Integer i = index.get(term);
            if (i != null) {
                v[i] += 1.0;
            }
        }
        double norm = 0.0;
        for (int i = 0; i < v.length; i++) {
            v[i] *= idf[i];
            norm += v[i] * v[i];
        }
        if (norm > 0.0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < v.length; i++) {
                v[i] /= norm;
            }
        }
        return v;
    }

    public int size() {
        return vocabulary.size();
    }

    public List<String> getVocabulary() {
        return vocabulary;
    }

    public double[] getIdf() {
        return idf.clone();
    }
}
