package com.finlens.backend.classification.model;

/**
 * Statistical text classifier. Implementations are immutable once loaded and safe for concurrent use.
 */
public interface ClassifierModel {

    /**
     * @param preprocessedText space-separated tokens
     * @return the most probable category and its probability in [0,1]
     */
    ClassifierPrediction predict(String preprocessedText);
}
