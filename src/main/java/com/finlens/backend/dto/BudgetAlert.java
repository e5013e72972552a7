package com.finlens.backend.dto;

import com.finlens.backend.enums.AlertSeverity;

/**
 * @param category a category code, or {@code overall}/{@code savings} for income-wide alerts
 */
public record BudgetAlert(String category, String message, AlertSeverity severity) {
}
