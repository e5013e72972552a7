package com.finlens.backend.classification;

import java.util.Optional;

import com.finlens.backend.dto.Transaction;

/**
 * One step of the categorization chain. Returns empty to hand the transaction to the next step.
 */
public interface CategorizationStrategy {

    String name();

    Optional<CategoryResolution> resolve(Transaction tx);
}
