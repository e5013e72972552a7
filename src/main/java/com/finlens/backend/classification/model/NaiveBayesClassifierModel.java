package com.finlens.backend.classification.model;

import java.util.List;
import java.util.Map;

import com.finlens.backend.enums.TransactionCategory;

/**
 * Multinomial naive Bayes over whitespace tokens. Scores are log-prior plus per-token log-likelihoods,
 * turned into probabilities with a softmax.
 */
public final class NaiveBayesClassifierModel implements ClassifierModel {

    private final List<TransactionCategory> classes;
    private final double[] logPriors;
    private final Map<String, double[]> tokenLogLikelihoods;
    private final double[] unknownTokenLogLikelihoods;

    public NaiveBayesClassifierModel(
            List<TransactionCategory> classes,
            double[] logPriors,
            Map<String, double[]> tokenLogLikelihoods,
            double[] unknownTokenLogLikelihoods
    ) {
        if (classes == null || classes.isEmpty()) {
            throw new IllegalArgumentException("classes are required");
        }
        int n = classes.size();
        if (logPriors == null || logPriors.length != n) {
            throw new IllegalArgumentException("logPriors must have one entry per class");
        }
        if (unknownTokenLogLikelihoods == null || unknownTokenLogLikelihoods.length != n) {
            throw new IllegalArgumentException("unknownTokenLogLikelihoods must have one entry per class");
        }
        Map<String, double[]> likelihoods = tokenLogLikelihoods == null ? Map.of() : tokenLogLikelihoods;
        for (Map.Entry<String, double[]> e : likelihoods.entrySet()) {
            if (e.getValue() == null || e.getValue().length != n) {
                throw new IllegalArgumentException("token '" + e.getKey() + "' must have one log-likelihood per class");
            }
        }

        this.classes = List.copyOf(classes);
        this.logPriors = logPriors.clone();
        this.tokenLogLikelihoods = Map.copyOf(likelihoods);
        this.unknownTokenLogLikelihoods = unknownTokenLogLikelihoods.clone();
    }

    @Override
    public ClassifierPrediction predict(String preprocessedText) {
        double[] scores = logPriors.clone();
        if (preprocessedText != null && !preprocessedText.isBlank()) {
            for (String token : preprocessedText.trim().split("\\s+")) {
                double[] ll = tokenLogLikelihoods.getOrDefault(token, unknownTokenLogLikelihoods);
                for (int c = 0; c < scores.length; c++) {
                    scores[c] += ll[c];
                }
            }
        }

        int best = 0;
        double max = scores[0];
        for (int c = 1; c < scores.length; c++) {
            if (scores[c] > max) {
                max = scores[c];
                best = c;
            }
        }

        double sum = 0.0;
        for (double s : scores) {
            sum += Math.exp(s - max);
        }
        double probability = 1.0 / sum;
        return new ClassifierPrediction(classes.get(best), probability);
    }

    public List<TransactionCategory> getClasses() {
        return classes;
    }
}
