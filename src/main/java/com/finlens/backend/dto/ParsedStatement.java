package com.finlens.backend.dto;

import java.util.List;

public record ParsedStatement(List<Transaction> transactions, ParseDiagnostics diagnostics) {

    public ParsedStatement {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
