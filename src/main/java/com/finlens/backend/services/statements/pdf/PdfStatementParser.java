package com.finlens.backend.services.statements.pdf;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Component;

import com.finlens.backend.config.PdfProperties;
import com.finlens.backend.dto.ParseDiagnostics;
import com.finlens.backend.dto.ParseDiagnostics.SkipReason;
import com.finlens.backend.dto.ParsedStatement;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.StatementFormat;
import com.finlens.backend.enums.TransactionType;
import com.finlens.backend.exceptions.NoTransactionsFoundException;
import com.finlens.backend.exceptions.StatementReadException;
import com.finlens.backend.services.statements.util.DateParser;
import com.finlens.backend.services.statements.util.MoneyParser;
import com.finlens.backend.services.statements.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Best-effort PDF statement parser: extracts text from the first pages and matches each line against an
 * ordered rule table. The first rule that matches a line wins; lines no rule matches are skipped.
 */
@Component
@Slf4j
public class PdfStatementParser {

    // Used to split entries when text extraction collapses newlines. Requires start-of-string or whitespace
    // before the date so references like "D01/12" inside descriptions are not split.
    private static final Pattern ENTRY_DATE_TOKEN = Pattern.compile(
            "(?:(?<=^)|(?<=\\s))(\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}(?:/\\d{2,4})?)\\s+");

    private static final Pattern FULL_DATE = Pattern.compile(
            "\\b(\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{4}|\\d{1,2}\\s+[A-Za-z]{3}\\s+\\d{4})\\b");

    private static final List<String> BALANCE_MARKERS = List.of(
            "opening balance",
            "closing balance",
            "balance forward",
            "balance brought forward",
            "balance carried forward",
            "previous balance",
            "beginning balance",
            "ending balance",
            "available balance");

    private final PdfTextExtractor pdfTextExtractor;
    private final PdfProperties pdfProperties;
    private final Clock clock;
    private final List<PdfLineRule> rules;

    public PdfStatementParser(PdfTextExtractor pdfTextExtractor, PdfProperties pdfProperties, Clock clock) {
        this.pdfTextExtractor = pdfTextExtractor;
        this.pdfProperties = pdfProperties;
        this.clock = clock;
        this.rules = resolveRules(pdfProperties);
    }

    public ParsedStatement parse(byte[] bytes) {
        ParseDiagnostics diagnostics = new ParseDiagnostics(StatementFormat.PDF);
        String text = extractText(bytes, diagnostics);

        if (text == null || text.isBlank()) {
            log.warn("[PdfStatement] no extractable text; the PDF may be scanned or restricted");
            throw new NoTransactionsFoundException(diagnostics);
        }

        int fallbackYear = inferStatementYear(text);
        List<String> lines = splitLinesSmart(text);

        List<Transaction> transactions = new ArrayList<>();
        int rowIndex = 0;
        for (String rawLine : lines) {
            String line = NormalizeUtil.normalizeDashes(rawLine).trim();
            if (line.isEmpty()) continue;

            diagnostics.recordRead();
            Transaction tx = parseLine(line, rowIndex, fallbackYear, diagnostics);
            if (tx != null) {
                transactions.add(tx);
                diagnostics.recordAccepted();
            }
            rowIndex++;
        }

        log.info("[PdfStatement] parsed pages={} lines={} accepted={} skipped={}",
                diagnostics.getPagesRead(), diagnostics.getRowsRead(), diagnostics.getRowsAccepted(), diagnostics.getSkipped());

        if (transactions.isEmpty()) {
            throw new NoTransactionsFoundException(diagnostics);
        }
        return new ParsedStatement(transactions, diagnostics);
    }

    private String extractText(byte[] bytes, ParseDiagnostics diagnostics) {
        try (PDDocument document = PDDocument.load(bytes)) {
            if (document.isEncrypted()) {
                // Owner-password only: content is readable once restrictions are dropped.
                document.setAllSecurityToBeRemoved(true);
            }
            int maxPages = pdfProperties.getMaxPages();
            diagnostics.setPagesRead(PdfTextExtractor.pagesToRead(document, maxPages));
            if (document.getNumberOfPages() > diagnostics.getPagesRead()) {
                log.info("[PdfStatement] document has {} pages; reading first {}", document.getNumberOfPages(), diagnostics.getPagesRead());
            }

            String text = safeExtractTextSorted(document, maxPages);
            if (text == null || text.isBlank()) {
                text = safeExtractText(document, maxPages);
            }
            return text;
        } catch (InvalidPasswordException e) {
            throw new StatementReadException("PDF statement is password protected", e);
        } catch (IOException e) {
            throw new StatementReadException("Failed to open PDF statement: " + e.getMessage(), e);
        }
    }

    private Transaction parseLine(String line, int rowIndex, int fallbackYear, ParseDiagnostics diagnostics) {
        for (PdfLineRule rule : rules) {
            Matcher m = rule.pattern().matcher(line);
            if (!m.matches()) continue;

            String description = cleanupDescription(m.group(rule.descriptionGroup()));
            if (isBalanceLine(description)) {
                diagnostics.recordSkip(SkipReason.BALANCE_LINE);
                return null;
            }
            if (description.isEmpty()) {
                diagnostics.recordSkip(SkipReason.EMPTY_DESCRIPTION);
                return null;
            }

            LocalDate date = parseDate(m.group(rule.dateGroup()), fallbackYear);
            if (date == null) {
                diagnostics.recordSkip(SkipReason.INVALID_DATE);
                return null;
            }

            String rawAmount = m.group(rule.amountGroup());
            BigDecimal amount = MoneyParser.parse(rawAmount);
            if (amount == null) {
                diagnostics.recordSkip(SkipReason.INVALID_AMOUNT);
                return null;
            }
            String marker = rule.markerGroup() > 0 ? m.group(rule.markerGroup()) : null;
            TransactionType markerType = markerType(marker);
            if (markerType != null) {
                amount = MoneyParser.applySign(amount, markerType);
            }
            if (amount.signum() == 0) {
                diagnostics.recordSkip(SkipReason.ZERO_AMOUNT);
                return null;
            }

            log.debug("[PdfStatement] rule={} matched line={}", rule.name(), line);
            return Transaction.builder()
                    .rowIndex(rowIndex)
                    .date(date)
                    .description(description)
                    .amount(amount)
                    .type(TransactionType.fromSignedAmount(amount))
                    .rawAmount(rawAmount)
                    .build();
        }

        diagnostics.recordSkip(SkipReason.UNMATCHED_LINE);
        return null;
    }

    static boolean isBalanceLine(String description) {
        if (description == null) return false;
        String desc = NormalizeUtil.normalize(description);
        for (String marker : BALANCE_MARKERS) {
            if (desc.contains(marker)) return true;
        }
        return desc.equals("balance") || desc.startsWith("balance ");
    }

    private static TransactionType markerType(String marker) {
        if (marker == null) return null;
        String m = marker.trim().toUpperCase(Locale.ROOT);
        if (m.equals("CR") || m.equals("C")) return TransactionType.CREDIT;
        if (m.equals("DR") || m.equals("D")) return TransactionType.DEBIT;
        return null;
    }

    private static LocalDate parseDate(String raw, int fallbackYear) {
        LocalDate date = DateParser.parse(raw);
        if (date != null) return date;
        return DateParser.parseDayMonth(raw, fallbackYear);
    }

    /**
     * Year of the last full date in the text, used for layouts that omit the year.
     */
    private int inferStatementYear(String text) {
        LocalDate last = null;
        Matcher m = FULL_DATE.matcher(text);
        while (m.find()) {
            LocalDate d = DateParser.parse(m.group(1));
            if (d != null) last = d;
        }
        return last != null ? last.getYear() : LocalDate.now(clock).getYear();
    }

    private static String cleanupDescription(String raw) {
        if (raw == null) return "";
        return raw.replaceAll("\\s+", " ").trim();
    }

    private static List<String> splitLines(String rawText) {
        if (rawText == null || rawText.isBlank()) return List.of();
        return List.of(rawText.replace('\u00A0', ' ').split("\\r?\\n"));
    }

    static List<String> splitLinesSmart(String rawText) {
        List<String> base = splitLines(rawText);

        long nonEmpty = base.stream().filter(s -> !s.isBlank()).count();
        // A page collapsed into one or two long lines: split entries on date tokens instead.
        if (nonEmpty <= 2) {
            List<String> byDate = splitByEntryDateTokens(rawText);
            if (byDate.size() > base.size()) {
                log.debug("[PdfStatement] collapsed text split into {} entries by date tokens", byDate.size());
                return byDate;
            }
        }
        return base;
    }

    private static List<String> splitByEntryDateTokens(String rawText) {
        String t = rawText.replace('\u00A0', ' ').replaceAll("\\r?\\n", " ").trim();
        if (t.isEmpty()) return List.of();

        Matcher m = ENTRY_DATE_TOKEN.matcher(t);
        List<Integer> starts = new ArrayList<>();
        while (m.find()) {
            starts.add(m.start(1));
        }
        if (starts.size() <= 1) {
            return splitLines(rawText);
        }

        List<String> out = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = (i + 1 < starts.size()) ? starts.get(i + 1) : t.length();
            String chunk = t.substring(start, end).trim();
            if (!chunk.isEmpty()) {
                out.add(chunk);
            }
        }
        return out;
    }

    private String safeExtractText(PDDocument document, int maxPages) {
        try {
            return pdfTextExtractor.extractText(document, maxPages);
        } catch (IOException e) {
            log.debug("[PdfStatement] unsorted extraction failed: {}", e.getMessage());
            return "";
        }
    }

    private String safeExtractTextSorted(PDDocument document, int maxPages) {
        try {
            return pdfTextExtractor.extractTextSorted(document, maxPages);
        } catch (IOException e) {
            log.debug("[PdfStatement] sorted extraction failed: {}", e.getMessage());
            return "";
        }
    }

    private static List<PdfLineRule> resolveRules(PdfProperties properties) {
        if (properties.getRules() == null || properties.getRules().isEmpty()) {
            return DefaultPdfLineRules.RULES;
        }
        List<PdfLineRule> configured = new ArrayList<>();
        for (PdfProperties.Rule rule : properties.getRules()) {
            configured.add(PdfLineRule.from(rule));
        }
        log.info("[PdfStatement] using {} configured line rules", configured.size());
        return List.copyOf(configured);
    }
}
