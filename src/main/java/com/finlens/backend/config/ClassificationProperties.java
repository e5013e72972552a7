package com.finlens.backend.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.finlens.backend.enums.TransactionCategory;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "finlens.classification")
public class ClassificationProperties {

    /**
     * Location of the classifier artifact (file path or classpath: resource). Empty means rule-only.
     */
    private String modelPath = "";

    /**
     * Minimum classifier probability for a prediction to be accepted.
     */
    private double confidenceThreshold = 0.4;

    /**
     * Tie-break order for keyword scoring.
     */
    private List<TransactionCategory> categoryPriority = new ArrayList<>(List.of(
            TransactionCategory.FOOD,
            TransactionCategory.TRANSPORT,
            TransactionCategory.UTILITIES,
            TransactionCategory.HEALTHCARE,
            TransactionCategory.INSURANCE,
            TransactionCategory.EDUCATION,
            TransactionCategory.INVESTMENT,
            TransactionCategory.SHOPPING,
            TransactionCategory.TRAVEL,
            TransactionCategory.ENTERTAINMENT,
            TransactionCategory.OTHER));

    /**
     * Optional keyword table (category code -> keyword -> weight) replacing the built-in one.
     */
    private Map<String, Map<String, Double>> keywords = new LinkedHashMap<>();
}
