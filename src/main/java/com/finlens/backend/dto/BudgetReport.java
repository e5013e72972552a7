package com.finlens.backend.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.finlens.backend.enums.TransactionCategory;

/**
 * @param monthlyIncome null when the batch has no income rows
 */
public record BudgetReport(
        BigDecimal monthlyIncome,
        String currency,
        List<BudgetRecommendation> recommendations,
        List<BudgetAlert> alerts,
        Map<TransactionCategory, BigDecimal> savingsPotential
) {
    public BudgetReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        savingsPotential = savingsPotential == null ? Map.of() : Map.copyOf(savingsPotential);
    }

    public Optional<BigDecimal> monthlyIncomeEstimate() {
        return Optional.ofNullable(monthlyIncome);
    }
}
