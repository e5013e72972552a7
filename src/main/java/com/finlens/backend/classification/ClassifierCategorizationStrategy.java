package com.finlens.backend.classification;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import com.finlens.backend.classification.model.ClassifierModel;
import com.finlens.backend.classification.model.ClassifierPrediction;
import com.finlens.backend.dto.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Accepts the classifier's prediction when its probability reaches the threshold. Model failures are
 * treated as "no prediction" so the chain falls through to the keyword rules.
 */
@Slf4j
public class ClassifierCategorizationStrategy implements CategorizationStrategy {

    private final ClassifierModel model;
    private final double confidenceThreshold;
    private final AtomicBoolean failureLogged = new AtomicBoolean(false);

    public ClassifierCategorizationStrategy(ClassifierModel model, double confidenceThreshold) {
        this.model = model;
        this.confidenceThreshold = confidenceThreshold;
    }

    @Override
    public String name() {
        return "classifier";
    }

    @Override
    public Optional<CategoryResolution> resolve(Transaction tx) {
        String text = TextPreprocessor.preprocess(tx.getDescription());
        if (text.isEmpty()) return Optional.empty();

        ClassifierPrediction prediction;
        try {
            prediction = model.predict(text);
        } catch (RuntimeException e) {
            if (failureLogged.compareAndSet(false, true)) {
                log.warn("[Classifier] prediction failed, falling back to keyword rules: {}", e.toString());
            } else {
                log.debug("[Classifier] prediction failed for row {}: {}", tx.getRowIndex(), e.toString());
            }
            return Optional.empty();
        }

        if (prediction == null || prediction.category() == null) return Optional.empty();
        double probability = prediction.probability();
        if (Double.isNaN(probability) || probability < confidenceThreshold) {
            return Optional.empty();
        }
        return Optional.of(new CategoryResolution(prediction.category(), probability, name()));
    }
}
