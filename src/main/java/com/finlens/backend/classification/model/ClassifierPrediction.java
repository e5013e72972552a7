package com.finlens.backend.classification.model;

import com.finlens.backend.enums.TransactionCategory;

public record ClassifierPrediction(TransactionCategory category, double probability) {
}
