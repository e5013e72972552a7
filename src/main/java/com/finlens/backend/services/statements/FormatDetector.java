package com.finlens.backend.services.statements;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.finlens.backend.enums.StatementFormat;
import com.finlens.backend.exceptions.UnsupportedFormatException;

/**
 * Classifies statement bytes as PDF or CSV from their signature, using the filename only as a hint.
 */
@Component
public class FormatDetector {

    static final int SAMPLE_SIZE = 1024;

    private static final byte[] PDF_SIGNATURE = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    public StatementFormat detect(byte[] bytes, String filename) {
        String name = filename == null ? "" : filename.trim().toLowerCase(Locale.ROOT);
        if (bytes == null || bytes.length == 0) {
            throw new UnsupportedFormatException(filename, "file is empty");
        }

        byte[] sample = Arrays.copyOf(bytes, Math.min(bytes.length, SAMPLE_SIZE));
        if (startsWithPdfSignature(sample)) {
            return StatementFormat.PDF;
        }
        if (name.endsWith(".pdf")) {
            throw new UnsupportedFormatException(filename, "missing %PDF- signature");
        }
        if (containsNul(sample)) {
            throw new UnsupportedFormatException(filename, "binary content is neither PDF nor CSV");
        }
        if (name.endsWith(".csv") || name.endsWith(".txt")) {
            return StatementFormat.CSV;
        }
        if (firstLineHasDelimiter(sample)) {
            return StatementFormat.CSV;
        }
        throw new UnsupportedFormatException(filename, "no CSV delimiter or PDF signature found");
    }

    private static boolean firstLineHasDelimiter(byte[] sample) {
        // ISO-8859-1 maps every byte, enough to look for ASCII delimiters.
        String text = new String(sample, StandardCharsets.ISO_8859_1);
        int newline = text.indexOf('\n');
        String firstLine = newline >= 0 ? text.substring(0, newline) : text;
        return firstLine.indexOf(',') >= 0
                || firstLine.indexOf(';') >= 0
                || firstLine.indexOf('\t') >= 0
                || firstLine.indexOf('|') >= 0;
    }

    private static boolean containsNul(byte[] sample) {
        for (byte b : sample) {
            if (b == 0) return true;
        }
        return false;
    }

    /**
     * "%PDF-" at the start of the sample, after an optional UTF-8 BOM and ASCII whitespace.
     */
    static boolean startsWithPdfSignature(byte[] sample) {
        int i = 0;
        if (sample.length >= 3 && (sample[0] & 0xFF) == 0xEF && (sample[1] & 0xFF) == 0xBB && (sample[2] & 0xFF) == 0xBF) {
            i = 3;
        }
        while (i < sample.length && isAsciiWhitespace(sample[i])) {
            i++;
        }
        if (sample.length - i < PDF_SIGNATURE.length) return false;
        for (int j = 0; j < PDF_SIGNATURE.length; j++) {
            if (sample[i + j] != PDF_SIGNATURE[j]) return false;
        }
        return true;
    }

    private static boolean isAsciiWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n' || b == '\f';
    }
}
