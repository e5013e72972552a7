package com.finlens.backend.dto;

import java.math.BigDecimal;

import com.finlens.backend.enums.TransactionCategory;

public record CategorySpending(
        TransactionCategory category,
        BigDecimal total,
        int count,
        BigDecimal mean,
        BigDecimal percentageOfExpenses
) {
}
