package com.finlens.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.finlens.backend.enums.TransactionCategory;
import com.finlens.backend.enums.TransactionType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical statement transaction.
 *
 * Created once by a statement parser, then enriched in place (currency, category, conversion)
 * by exactly one chunk worker. Aggregation treats it as read-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    /** Zero-based position of the source row/line the transaction was read from. */
    private int rowIndex;
    private LocalDate date;
    private String description;
    /** Signed: debit negative, credit positive. */
    private BigDecimal amount;
    private String currency;
    private TransactionCategory category;
    private double confidence;
    private TransactionType type;

    // Raw values carried from the source for detection.
    private String rawAmount;
    private String sourceCurrency;
    private String sourceCategory;

    // Set when the amount was converted to another currency.
    private BigDecimal originalAmount;
    private String originalCurrency;
    private BigDecimal conversionRate;

    public boolean isExpense() {
        return amount != null && amount.signum() < 0;
    }

    public boolean isIncome() {
        return amount != null && amount.signum() > 0;
    }
}
