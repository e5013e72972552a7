package com.finlens.backend.enums;

import java.util.Locale;
import java.util.Optional;

public enum TransactionCategory {
    FOOD("food"),
    TRANSPORT("transport"),
    ENTERTAINMENT("entertainment"),
    SHOPPING("shopping"),
    UTILITIES("utilities"),
    HEALTHCARE("healthcare"),
    EDUCATION("education"),
    TRAVEL("travel"),
    INSURANCE("insurance"),
    INVESTMENT("investment"),
    OTHER("other");

    private final String code;

    TransactionCategory(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a category from its code or enum name, case-insensitively.
     */
    public static Optional<TransactionCategory> fromCode(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TransactionCategory category : values()) {
            if (category.code.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
