package com.finlens.backend.enums;

public enum StatementFormat {
    CSV,
    PDF
}
