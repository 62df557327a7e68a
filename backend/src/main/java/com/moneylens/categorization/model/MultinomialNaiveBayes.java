package com.moneylens.categorization.model;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Multinomial naive Bayes over non-negative feature vectors with additive smoothing.
 * Classes are kept in sorted order.
 */
public final class MultinomialNaiveBayes {

    private final List<String> classes;
    private final double[] classLogPrior;
    private final double[][] featureLogProb;

    MultinomialNaiveBayes(List<String> classes, double[] classLogPrior, double[][] featureLogProb) {
        if (classes.size() != classLogPrior.length || classes.size() != featureLogProb.length) {
            throw new IllegalArgumentException("class count mismatch");
        }
        this.classes = List.copyOf(classes);
        this.classLogPrior = classLogPrior.clone();
        this.featureLogProb = new double[featureLogProb.length][];
        for (int c = 0; c < featureLogProb.length; c++) {
            this.featureLogProb[c] = featureLogProb[c].clone();
        }
    }

    public static MultinomialNaiveBayes fit(double[][] x, List<String> labels, double alpha) {
        if (x.length != labels.size() || x.length == 0) {
            throw new IllegalArgumentException("need one label per row and at least one row");
        }
        List<String> classes = new ArrayList<>(new TreeSet<>(labels));
        int features = x[0].length;
        double[] classCount = new double[classes.size()];
        double[][] featureCount = new double[classes.size()][features];
        for (int row = 0; row < x.length; row++) {
            int c = classes.indexOf(labels.get(row));
            classCount[c] += 1.0;
            for (int j = 0; j < features; j++) {
                featureCount[c][j] += x[row][j];
            }
        }
        double[] prior = new double[classes.size()];
        double[][] logProb = new double[classes.size()][features];
        for (int c = 0; c < classes.size(); c++) {
            prior[c] = Math.log(classCount[c] / x.length);
            double total = 0.0;
            for (int j = 0; j < features; j++) {
                total += featureCount[c][j] + alpha;
            }
            for (int j = 0; j < features; j++) {
                logProb[c][j] = Math.log((featureCount[c][j] + alpha) / total);
            }
        }
        return new MultinomialNaiveBayes(classes, prior, logProb);
    }

    /**
     * Posterior probability per class (same order as {@link #getClasses()}); sums to 1.
     */
    public double[] predictProba(double[] x) {
        double[] jll = new double[classes.size()];
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < classes.size(); c++) {
            double s = classLogPrior[c];
            double[] lp = featureLogProb[c];
            for (int j = 0; j < x.length; j++) {
                if (x[j] != 0.0) {
                    s += x[j] * lp[j];
                }
            }
            jll[c] = s;
            max = Math.max(max, s);
        }
        double sum = 0.0;
        for (int c = 0; c < jll.length; c++) {
            jll[c] = Math.exp(jll[c] - max);
            sum += jll[c];
        }
        for (int c = 0; c < jll.length; c++) {
            jll[c] /= sum;
        }
        return jll;
    }

    public List<String> getClasses() {
        return classes;
    }

    public double[] getClassLogPrior() {
        return classLogPrior.clone();
    }

    public double[][] getFeatureLogProb() {
        double[][] copy = new double[featureLogProb.length][];
        for (int c = 0; c < featureLogProb.length; c++) {
            copy[c] = featureLogProb[c].clone();
        }
        return copy;
    }
}
