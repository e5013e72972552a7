package com.finlens.backend.dto;

import java.util.List;

import com.finlens.backend.enums.StatementFormat;

public record StatementProcessingResult(
        StatementFormat format,
        List<Transaction> transactions,
        String primaryCurrency,
        ParseDiagnostics diagnostics,
        List<String> warnings
) {
    public StatementProcessingResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
