package com.finlens.backend.classification;

import java.util.Optional;

import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.TransactionCategory;

/**
 * Keeps a category already present in the source statement when it names one of the known categories.
 */
public class ProvidedCategoryStrategy implements CategorizationStrategy {

    @Override
    public String name() {
        return "provided";
    }

    @Override
    public Optional<CategoryResolution> resolve(Transaction tx) {
        return TransactionCategory.fromCode(tx.getSourceCategory())
                .filter(category -> category != TransactionCategory.OTHER)
                .map(category -> new CategoryResolution(category, 1.0, name()));
    }
}
