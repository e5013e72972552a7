package com.finlens.backend.services.statements.csv;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import com.finlens.backend.config.CsvProperties;
import com.finlens.backend.config.PipelineProperties;
import com.finlens.backend.dto.ParseDiagnostics;
import com.finlens.backend.dto.ParseDiagnostics.SkipReason;
import com.finlens.backend.dto.ParsedStatement;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.StatementFormat;
import com.finlens.backend.enums.TransactionType;
import com.finlens.backend.exceptions.MissingColumnsException;
import com.finlens.backend.exceptions.NoTransactionsFoundException;
import com.finlens.backend.exceptions.RowLimitExceededException;
import com.finlens.backend.exceptions.StatementReadException;
import com.finlens.backend.services.statements.csv.CsvHeaderAliases.Column;
import com.finlens.backend.services.statements.util.DateParser;
import com.finlens.backend.services.statements.util.MoneyParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class CsvStatementParser {

    private static final char[] DELIMITER_CANDIDATES = {',', ';', '\t', '|'};

    private static final Set<String> DEBIT_TOKENS = Set.of(
            "debit", "dr", "d", "expense", "withdrawal", "payment", "purchase", "charge");
    private static final Set<String> CREDIT_TOKENS = Set.of(
            "credit", "cr", "c", "income", "deposit", "refund");

    private final CsvProperties csvProperties;
    private final PipelineProperties pipelineProperties;

    public ParsedStatement parse(byte[] bytes) {
        ParseDiagnostics diagnostics = new ParseDiagnostics(StatementFormat.CSV);
        String text = CsvDecoder.decode(bytes, csvProperties.getEncodings(), diagnostics);

        char delimiter = sniffDelimiter(firstLine(text));
        diagnostics.setDelimiter(delimiter);

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setIgnoreSurroundingSpaces(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .setTrim(true)
                .build();

        List<Transaction> transactions = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            List<String> headers = parser.getHeaderNames();
            Map<Column, Integer> columns = CsvHeaderAliases.resolve(headers);
            requireColumns(columns, headers);

            int maxRows = pipelineProperties.getMaxRows();
            int rowIndex = 0;
            for (CSVRecord record : parser) {
                // Raw rows count against the cap, rejected ones included.
                if (rowIndex >= maxRows) {
                    throw new RowLimitExceededException(rowIndex + 1, maxRows);
                }
                diagnostics.recordRead();
                Transaction tx = toTransaction(record, columns, rowIndex, diagnostics);
                if (tx != null) {
                    transactions.add(tx);
                    diagnostics.recordAccepted();
                }
                rowIndex++;
            }
        } catch (IOException | UncheckedIOException e) {
            throw new StatementReadException("Failed to read CSV statement: " + e.getMessage(), e);
        }

        log.info("[CsvStatement] parsed encoding={} delimiter='{}' rowsRead={} accepted={} skipped={}",
                diagnostics.getEncoding(), printable(delimiter), diagnostics.getRowsRead(),
                diagnostics.getRowsAccepted(), diagnostics.getSkipped());

        if (transactions.isEmpty()) {
            throw new NoTransactionsFoundException(diagnostics);
        }
        return new ParsedStatement(transactions, diagnostics);
    }

    private Transaction toTransaction(CSVRecord record, Map<Column, Integer> columns, int rowIndex, ParseDiagnostics diagnostics) {
        LocalDate date = DateParser.parse(value(record, columns, Column.DATE));
        if (date == null) {
            diagnostics.recordSkip(SkipReason.INVALID_DATE);
            return null;
        }

        String description = value(record, columns, Column.DESCRIPTION).replaceAll("\\s+", " ").trim();
        if (description.isEmpty()) {
            diagnostics.recordSkip(SkipReason.EMPTY_DESCRIPTION);
            return null;
        }

        String rawAmount;
        BigDecimal amount;
        if (columns.containsKey(Column.AMOUNT)) {
            rawAmount = value(record, columns, Column.AMOUNT);
            amount = MoneyParser.parse(rawAmount);
            TransactionType explicitType = parseType(value(record, columns, Column.TYPE));
            if (amount != null && explicitType != null) {
                amount = MoneyParser.applySign(amount, explicitType);
            }
        } else {
            String rawDebit = value(record, columns, Column.DEBIT);
            String rawCredit = value(record, columns, Column.CREDIT);
            rawAmount = rawDebit.isEmpty() ? rawCredit : rawDebit;
            amount = pairDebitCredit(rawDebit, rawCredit);
        }

        if (amount == null) {
            diagnostics.recordSkip(SkipReason.INVALID_AMOUNT);
            return null;
        }
        if (amount.signum() == 0) {
            diagnostics.recordSkip(SkipReason.ZERO_AMOUNT);
            return null;
        }

        String currency = value(record, columns, Column.CURRENCY);
        String category = value(record, columns, Column.CATEGORY);

        return Transaction.builder()
                .rowIndex(rowIndex)
                .date(date)
                .description(description)
                .amount(amount)
                .type(TransactionType.fromSignedAmount(amount))
                .rawAmount(rawAmount)
                .sourceCurrency(currency.isEmpty() ? null : currency)
                .sourceCategory(category.isEmpty() ? null : category)
                .build();
    }

    /**
     * amount = credit - debit. A missing side counts as zero; both sides missing is unparsable.
     */
    private static BigDecimal pairDebitCredit(String rawDebit, String rawCredit) {
        BigDecimal debit = MoneyParser.parse(rawDebit);
        BigDecimal credit = MoneyParser.parse(rawCredit);
        if (debit == null && credit == null) return null;

        BigDecimal result = BigDecimal.ZERO;
        if (credit != null) result = result.add(credit.abs());
        if (debit != null) result = result.subtract(debit.abs());
        return result;
    }

    private static TransactionType parseType(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String token = raw.trim().toLowerCase(Locale.ROOT);
        if (DEBIT_TOKENS.contains(token)) return TransactionType.DEBIT;
        if (CREDIT_TOKENS.contains(token)) return TransactionType.CREDIT;
        return null;
    }

    private static void requireColumns(Map<Column, Integer> columns, List<String> headers) {
        List<String> missing = new ArrayList<>();
        if (!columns.containsKey(Column.DATE)) missing.add("date");
        if (!columns.containsKey(Column.DESCRIPTION)) missing.add("description");
        if (!columns.containsKey(Column.AMOUNT) && !columns.containsKey(Column.DEBIT) && !columns.containsKey(Column.CREDIT)) {
            missing.add("amount");
        }
        if (!missing.isEmpty()) {
            throw new MissingColumnsException(missing, headers);
        }
    }

    private static String value(CSVRecord record, Map<Column, Integer> columns, Column column) {
        Integer index = columns.get(column);
        if (index == null || index >= record.size()) return "";
        String v = record.get(index);
        return v == null ? "" : v.trim();
    }

    /**
     * Most frequent candidate in the header line; ties keep the earlier candidate, so comma wins.
     */
    static char sniffDelimiter(String headerLine) {
        if (headerLine == null || headerLine.isEmpty()) return ',';

        char best = ',';
        int bestCount = 0;
        for (char candidate : DELIMITER_CANDIDATES) {
            int count = countOutsideQuotes(headerLine, candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static int countOutsideQuotes(String line, char c) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                quoted = !quoted;
            } else if (ch == c && !quoted) {
                count++;
            }
        }
        return count;
    }

    private static String firstLine(String text) {
        if (text == null) return "";
        for (String line : text.split("\\r?\\n")) {
            if (!line.isBlank()) return line;
        }
        return "";
    }

    private static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
