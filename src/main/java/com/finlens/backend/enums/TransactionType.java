package com.finlens.backend.enums;

import java.math.BigDecimal;

public enum TransactionType {
    CREDIT("credit"),
    DEBIT("debit");

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static TransactionType fromSignedAmount(BigDecimal amount) {
        if (amount == null) return DEBIT;
        return amount.signum() < 0 ? DEBIT : CREDIT;
    }
}
