package com.finlens.backend.services.statements.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Tries an ordered list of date layouts: ISO first, then US, then EU, then textual month names.
 * Resolution is strict, so "13/01/2024" is rejected as US and accepted as EU.
 */
public final class DateParser {

    private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ].*$");

    private static final List<DateTimeFormatter> FORMATS = List.of(
            // ISO
            strict("uuuu-MM-dd"),
            strict("uuuu/MM/dd"),
            // US
            strict("MM/dd/uuuu"),
            strict("M/d/uuuu"),
            strict("MM-dd-uuuu"),
            strict("MM/dd/uu"),
            // EU
            strict("dd/MM/uuuu"),
            strict("d/M/uuuu"),
            strict("dd-MM-uuuu"),
            strict("dd.MM.uuuu"),
            strict("dd/MM/uu"),
            // Textual
            strict("d MMM uuuu"),
            strict("MMM d, uuuu"),
            strict("MMM d uuuu"),
            strict("d MMMM uuuu"),
            strict("MMMM d, uuuu"));

    private static final List<DateTimeFormatter> DAY_MONTH_FORMATS = List.of(
            strict("d/M/uuuu"),
            strict("d MMM uuuu"));

    private DateParser() {}

    /**
     * @return the parsed date, or null when no layout matches
     */
    public static LocalDate parse(String raw) {
        if (raw == null) return null;
        String t = raw.trim().replaceAll("\\s+", " ");
        if (t.isEmpty()) return null;

        if (ISO_DATE_TIME.matcher(t).matches()) {
            t = t.substring(0, 10);
        }

        for (DateTimeFormatter f : FORMATS) {
            try {
                return LocalDate.parse(t, f);
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return null;
    }

    /**
     * Parses a day-first date without a year ("05/03", "05 MAR") against the given year.
     */
    public static LocalDate parseDayMonth(String dayMonth, int year) {
        if (dayMonth == null || dayMonth.isBlank()) return null;
        String t = dayMonth.trim().replaceAll("\\s+", " ") + (dayMonth.contains("/") ? "/" : " ") + year;
        for (DateTimeFormatter f : DAY_MONTH_FORMATS) {
            try {
                return LocalDate.parse(t, f);
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return null;
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
