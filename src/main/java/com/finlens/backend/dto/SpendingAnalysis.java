package com.finlens.backend.dto;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import lombok.Builder;

@Builder
public record SpendingAnalysis(
        BigDecimal totalExpenses,
        BigDecimal totalIncome,
        int expenseCount,
        BigDecimal averageDailyExpense,
        List<CategorySpending> categoryBreakdown,
        Map<YearMonth, BigDecimal> monthlySpending,
        Map<DayOfWeek, BigDecimal> dayOfWeekPattern,
        Map<String, BigDecimal> topMerchants,
        DateRange dateRange,
        String currency,
        List<String> currenciesFound
) {
}
