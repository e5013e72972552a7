package com.finlens.backend.services.statements.util;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.finlens.backend.enums.TransactionType;

/**
 * Parses free-form money text such as "$1,234.56", "1.234,56 €", "(45.00)", "12.00-" or "150.00 CR".
 *
 * The decimal separator is inferred from the grouping pattern: with both separators present the last one is
 * the decimal; a lone comma followed by one or two digits is a decimal comma; repeated separators are grouping.
 */
public final class MoneyParser {

    /**
     * CR/DR marker as its own token, so "150000 IDR" keeps its sign.
     */
    private static final Pattern SIGN_MARKER = Pattern.compile("(?<![A-Za-z])(CR|DR)$", Pattern.CASE_INSENSITIVE);

    private MoneyParser() {}

    /**
     * @return the signed amount, or null when the text holds no number
     */
    public static BigDecimal parse(String raw) {
        if (raw == null) return null;
        String t = NormalizeUtil.normalizeDashes(raw).trim();
        if (t.isEmpty()) return null;

        boolean negative = false;

        Matcher marker = SIGN_MARKER.matcher(t);
        if (marker.find()) {
            negative = "DR".equalsIgnoreCase(marker.group(1));
            t = t.substring(0, marker.start()).trim();
        }

        if (t.startsWith("(") && t.endsWith(")")) {
            negative = true;
            t = t.substring(1, t.length() - 1).trim();
        }

        // Trailing minus, e.g. "943.49-".
        if (t.endsWith("-")) {
            negative = true;
            t = t.substring(0, t.length() - 1).trim();
        }

        int firstDigit = indexOfFirstDigit(t);
        if (firstDigit < 0) return null;
        String prefix = t.substring(0, firstDigit);
        if (prefix.contains("-")) negative = true;

        String digits = t.replaceAll("[^0-9.,]", "");
        String plain = toPlainDecimal(digits);
        if (plain == null) return null;

        try {
            BigDecimal value = new BigDecimal(plain);
            return negative ? value.negate() : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Forces the sign implied by a transaction type: debits negative, credits positive.
     */
    public static BigDecimal applySign(BigDecimal amount, TransactionType type) {
        if (amount == null) return null;
        if (type == TransactionType.DEBIT) {
            return amount.signum() < 0 ? amount : amount.negate();
        }
        if (type == TransactionType.CREDIT) {
            return amount.abs();
        }
        return amount;
    }

    static String toPlainDecimal(String digits) {
        if (digits.isEmpty()) return null;

        int lastComma = digits.lastIndexOf(',');
        int lastDot = digits.lastIndexOf('.');

        String result;
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                result = digits.replace(".", "").replace(',', '.');
            } else {
                result = digits.replace(",", "");
            }
        } else if (lastComma >= 0) {
            int commas = digits.length() - digits.replace(",", "").length();
            int decimals = digits.length() - lastComma - 1;
            if (commas == 1 && decimals >= 1 && decimals <= 2) {
                result = digits.replace(',', '.');
            } else {
                result = digits.replace(",", "");
            }
        } else if (lastDot >= 0) {
            int dots = digits.length() - digits.replace(".", "").length();
            result = dots > 1 ? digits.replace(".", "") : digits;
        } else {
            result = digits;
        }

        if (result.isEmpty() || result.equals(".")) return null;
        return result;
    }

    private static int indexOfFirstDigit(String t) {
        for (int i = 0; i < t.length(); i++) {
            if (Character.isDigit(t.charAt(i))) return i;
        }
        return -1;
    }
}
