package com.finlens.backend.classification;

import java.util.Optional;

import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.TransactionCategory;

public class DefaultCategoryStrategy implements CategorizationStrategy {

    @Override
    public String name() {
        return "default";
    }

    @Override
    public Optional<CategoryResolution> resolve(Transaction tx) {
        return Optional.of(new CategoryResolution(TransactionCategory.OTHER, 0.0, name()));
    }
}
