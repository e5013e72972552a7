package com.finlens.backend.exceptions;

import com.finlens.backend.dto.ParseDiagnostics;

public class NoTransactionsFoundException extends StatementProcessingException {

    private final transient ParseDiagnostics diagnostics;

    public NoTransactionsFoundException(ParseDiagnostics diagnostics) {
        super("No transactions found in statement; " + diagnostics.summary());
        this.diagnostics = diagnostics;
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
