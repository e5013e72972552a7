package com.finlens.backend.services.statements.pdf;

import java.util.List;

/**
 * Built-in statement layouts, most specific first. Lines carrying a running balance are tried before the
 * plain ones, otherwise the balance would be read as the amount.
 */
public final class DefaultPdfLineRules {

    // Optional sign/parenthesis, up to three symbol characters (R$, C$, $), two decimal places.
    static final String AMOUNT = "([-+(]?[^\\s\\d]{0,3}\\d[\\d.,]*[.,]\\d{2}\\)?-?)";
    static final String BALANCE = "[-+(]?[^\\s\\d]{0,3}\\d[\\d.,]*[.,]\\d{2}\\)?-?";
    static final String MARKER = "(?:\\s*(CR|DR|C|D)\\b)?";

    static final String ISO_DATE = "(\\d{4}-\\d{2}-\\d{2})";
    static final String SLASH_DATE = "(\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{2,4})";
    static final String TEXT_DATE = "(\\d{1,2}\\s+[A-Za-z]{3}(?:\\s+\\d{4})?)";
    static final String DAY_MONTH = "(\\d{2}/\\d{2})";

    public static final List<PdfLineRule> RULES = List.of(
            PdfLineRule.of("iso-with-balance", "^" + ISO_DATE + "\\s+(.+?)\\s+" + AMOUNT + MARKER + "\\s+" + BALANCE + "$", 1, 2, 3, 4),
            PdfLineRule.of("iso", "^" + ISO_DATE + "\\s+(.+?)\\s+" + AMOUNT + MARKER + "$", 1, 2, 3, 4),
            PdfLineRule.of("slash-with-balance", "^" + SLASH_DATE + "\\s+(.+?)\\s+" + AMOUNT + MARKER + "\\s+" + BALANCE + "$", 1, 2, 3, 4),
            PdfLineRule.of("slash", "^" + SLASH_DATE + "\\s+(.+?)\\s+" + AMOUNT + MARKER + "$", 1, 2, 3, 4),
            PdfLineRule.of("day-month-name-with-balance", "^" + TEXT_DATE + "\\s+(.+?)\\s+" + AMOUNT + MARKER + "\\s+" + BALANCE + "$", 1, 2, 3, 4),
            PdfLineRule.of("day-month-name", "^" + TEXT_DATE + "\\s+(.+?)\\s+" + AMOUNT + MARKER + "$", 1, 2, 3, 4),
            PdfLineRule.of("day-month-with-balance", "^" + DAY_MONTH + "\\s+(.+?)\\s+" + AMOUNT + MARKER + "\\s+" + BALANCE + "$", 1, 2, 3, 4),
            PdfLineRule.of("day-month", "^" + DAY_MONTH + "\\s+(.+?)\\s+" + AMOUNT + MARKER + "$", 1, 2, 3, 4));

    private DefaultPdfLineRules() {}
}
