package com.finlens.backend.config;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.finlens.backend.enums.TransactionCategory;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "finlens.budget")
public class BudgetProperties {

    /**
     * Share of monthly income recommended per category.
     */
    private Map<TransactionCategory, BigDecimal> percentages = defaultPercentages();

    /**
     * Severity becomes high once actual spend exceeds recommended times this ratio.
     */
    private BigDecimal highSeverityRatio = new BigDecimal("1.5");

    /**
     * Total monthly spend above this share of income raises the overall alert.
     */
    private BigDecimal overallSpendRatio = new BigDecimal("0.80");

    /**
     * Savings rate below this value raises the savings alert.
     */
    private BigDecimal savingsTarget = new BigDecimal("0.20");

    public BigDecimal percentageFor(TransactionCategory category) {
        BigDecimal pct = percentages.get(category);
        return pct != null ? pct : BigDecimal.ZERO;
    }

    private static Map<TransactionCategory, BigDecimal> defaultPercentages() {
        Map<TransactionCategory, BigDecimal> map = new EnumMap<>(TransactionCategory.class);
        map.put(TransactionCategory.FOOD, new BigDecimal("0.15"));
        map.put(TransactionCategory.TRANSPORT, new BigDecimal("0.10"));
        map.put(TransactionCategory.ENTERTAINMENT, new BigDecimal("0.05"));
        map.put(TransactionCategory.SHOPPING, new BigDecimal("0.10"));
        map.put(TransactionCategory.UTILITIES, new BigDecimal("0.08"));
        map.put(TransactionCategory.HEALTHCARE, new BigDecimal("0.08"));
        map.put(TransactionCategory.EDUCATION, new BigDecimal("0.05"));
        map.put(TransactionCategory.TRAVEL, new BigDecimal("0.05"));
        map.put(TransactionCategory.INSURANCE, new BigDecimal("0.08"));
        map.put(TransactionCategory.INVESTMENT, new BigDecimal("0.20"));
        map.put(TransactionCategory.OTHER, new BigDecimal("0.06"));
        return map;
    }
}
