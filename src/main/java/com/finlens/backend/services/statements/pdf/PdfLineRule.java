package com.finlens.backend.services.statements.pdf;

import java.util.regex.Pattern;

import com.finlens.backend.config.PdfProperties;

/**
 * One statement line layout: a regex plus the groups holding date, description, amount and an optional
 * credit/debit marker ({@code markerGroup} 0 when absent).
 */
public record PdfLineRule(
        String name,
        Pattern pattern,
        int dateGroup,
        int descriptionGroup,
        int amountGroup,
        int markerGroup
) {
    public PdfLineRule {
        if (pattern == null) throw new IllegalArgumentException("pattern is required");
        if (dateGroup <= 0 || descriptionGroup <= 0 || amountGroup <= 0) {
            throw new IllegalArgumentException("rule '" + name + "': date, description and amount groups are required");
        }
        int groups = pattern.matcher("").groupCount();
        int highest = Math.max(Math.max(dateGroup, descriptionGroup), Math.max(amountGroup, markerGroup));
        if (highest > groups) {
            throw new IllegalArgumentException("rule '" + name + "' references group " + highest
                    + " but pattern has " + groups);
        }
    }

    public static PdfLineRule of(String name, String regex, int dateGroup, int descriptionGroup, int amountGroup, int markerGroup) {
        return new PdfLineRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                dateGroup, descriptionGroup, amountGroup, markerGroup);
    }

    public static PdfLineRule from(PdfProperties.Rule rule) {
        String name = rule.getName() == null || rule.getName().isBlank() ? "custom" : rule.getName();
        if (rule.getPattern() == null || rule.getPattern().isBlank()) {
            throw new IllegalArgumentException("rule '" + name + "': pattern is required");
        }
        return of(name, rule.getPattern(), rule.getDateGroup(), rule.getDescriptionGroup(),
                rule.getAmountGroup(), rule.getMarkerGroup());
    }
}
