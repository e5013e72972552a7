package com.finlens.backend.enums;

/**
 * Declaration order is the alert sort order: most severe first.
 */
public enum AlertSeverity {
    HIGH("high"),
    MEDIUM("medium");

    private final String code;

    AlertSeverity(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
