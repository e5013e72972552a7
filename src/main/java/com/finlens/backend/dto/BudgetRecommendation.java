package com.finlens.backend.dto;

import java.math.BigDecimal;

import com.finlens.backend.enums.AlertSeverity;
import com.finlens.backend.enums.TransactionCategory;

/**
 * @param severity null when actual spend is within the recommendation
 */
public record BudgetRecommendation(
        TransactionCategory category,
        BigDecimal recommended,
        BigDecimal current,
        BigDecimal difference,
        BigDecimal percentageOfIncome,
        AlertSeverity severity
) {
    public boolean isOverBudget() {
        return severity != null;
    }
}
