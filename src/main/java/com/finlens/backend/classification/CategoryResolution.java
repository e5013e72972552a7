package com.finlens.backend.classification;

import com.finlens.backend.enums.TransactionCategory;

/**
 * @param source name of the strategy that produced the category
 */
public record CategoryResolution(TransactionCategory category, double confidence, String source) {

    public CategoryResolution {
        if (category == null) throw new IllegalArgumentException("category is required");
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
