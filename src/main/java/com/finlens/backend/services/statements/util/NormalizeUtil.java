package com.finlens.backend.services.statements.util;

import java.text.Normalizer;
import java.util.Locale;

public final class NormalizeUtil {

    private NormalizeUtil() {}

    /**
     * Lowercase, accent-free, single-spaced text.
     * Example: "Café  Déjà Vu" => "cafe deja vu"
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";

        String result = text.toLowerCase(Locale.ROOT);

        result = Normalizer.normalize(result, Normalizer.Form.NFD);
        result = result.replaceAll("\\p{M}", "");

        // PDFBox often emits NBSP and other separators that do not match \s.
        result = result.replace('\u00A0', ' ');
        result = result.replaceAll("\\p{Z}+", " ");

        return result.replaceAll("\\s+", " ").trim();
    }

    /**
     * {@link #normalize(String)} with punctuation replaced by spaces, for word-boundary keyword matching.
     */
    public static String normalizeForMatching(String text) {
        String result = normalize(text);
        if (result.isEmpty()) return result;
        result = result.replaceAll("[^\\p{L}\\p{N}]+", " ");
        return result.replaceAll("\\s+", " ").trim();
    }

    /**
     * Canonical header key: trimmed, lowercase, spaces and hyphens folded to underscores.
     */
    public static String normalizeHeader(String header) {
        if (header == null) return "";
        String result = header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
        return result.replaceAll("[\\s\\-]+", "_");
    }

    /**
     * Folds unicode minus and dash variants that PDFs emit into ASCII '-', and NBSP into a space.
     */
    public static String normalizeDashes(String text) {
        if (text == null) return null;
        return text.replace('\u00A0', ' ')
                .replace('−', '-')
                .replace('–', '-')
                .replace('—', '-');
    }
}
