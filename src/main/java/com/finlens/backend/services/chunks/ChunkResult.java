package com.finlens.backend.services.chunks;

import java.util.List;

import com.finlens.backend.dto.Transaction;

public record ChunkResult(List<Transaction> transactions, List<String> warnings) {

    public ChunkResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
