package com.finlens.backend.services.statements.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.finlens.backend.config.CsvProperties;
import com.finlens.backend.config.PipelineProperties;
import com.finlens.backend.dto.ParseDiagnostics.SkipReason;
import com.finlens.backend.dto.ParsedStatement;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.TransactionType;
import com.finlens.backend.exceptions.EncodingException;
import com.finlens.backend.exceptions.MissingColumnsException;
import com.finlens.backend.exceptions.NoTransactionsFoundException;
import com.finlens.backend.exceptions.RowLimitExceededException;

@DisplayName("CsvStatementParser")
class CsvStatementParserTest {

    private CsvProperties properties;
    private PipelineProperties pipelineProperties;
    private CsvStatementParser parser;

    @BeforeEach
    void setUp() {
        properties = new CsvProperties();
        pipelineProperties = new PipelineProperties();
        parser = new CsvStatementParser(properties, pipelineProperties);
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void resolvesHeaderAliases() {
        String csv = """
                Transaction_Date,Payee,Amount,Currency
                2024-01-15,Starbucks,-4.50,USD
                """;

        ParsedStatement parsed = parser.parse(utf8(csv));

        assertEquals(1, parsed.transactions().size());
        Transaction tx = parsed.transactions().get(0);
        assertEquals(LocalDate.of(2024, 1, 15), tx.getDate());
        assertEquals("Starbucks", tx.getDescription());
        assertAmount("-4.50", tx.getAmount());
        assertEquals(TransactionType.DEBIT, tx.getType());
        assertEquals("USD", tx.getSourceCurrency());
        assertEquals("UTF-8", parsed.diagnostics().getEncoding());
        assertEquals(',', parsed.diagnostics().getDelimiter());
    }

    @Test
    void pairsDebitAndCreditColumnsWithUsDates() {
        String csv = """
                Date,Description,Debit,Credit
                01/05/2024,Coffee Shop,4.50,
                01/31/2024,Payroll,,2500.00
                """;

        List<Transaction> txs = parser.parse(utf8(csv)).transactions();

        assertEquals(2, txs.size());
        assertEquals(LocalDate.of(2024, 1, 5), txs.get(0).getDate());
        assertAmount("-4.50", txs.get(0).getAmount());
        assertEquals(LocalDate.of(2024, 1, 31), txs.get(1).getDate());
        assertAmount("2500.00", txs.get(1).getAmount());
        assertEquals(TransactionType.CREDIT, txs.get(1).getType());
    }

    @Test
    void loneDebitColumnProducesNegativeAmounts() {
        String csv = """
                date,description,debit
                2024-02-01,Netflix,15.99
                """;

        Transaction tx = parser.parse(utf8(csv)).transactions().get(0);

        assertAmount("-15.99", tx.getAmount());
    }

    @Test
    void sniffsSemicolonAndParsesEuropeanValues() {
        String csv = """
                Posted Date;Merchant;Amount
                15/01/2024;Cafe Central;-12,50
                16/01/2024;Salary;1.250,00
                """;

        ParsedStatement parsed = parser.parse(utf8(csv));

        assertEquals(';', parsed.diagnostics().getDelimiter());
        assertEquals(LocalDate.of(2024, 1, 15), parsed.transactions().get(0).getDate());
        assertAmount("-12.50", parsed.transactions().get(0).getAmount());
        assertAmount("1250.00", parsed.transactions().get(1).getAmount());
    }

    @Test
    void typeColumnOverridesAmountSign() {
        String csv = """
                date,description,amount,type
                2024-03-01,Refund,20.00,credit
                2024-03-02,Groceries,54.10,debit
                2024-03-03,Gym,-30.00,unknown
                """;

        List<Transaction> txs = parser.parse(utf8(csv)).transactions();

        assertAmount("20.00", txs.get(0).getAmount());
        assertAmount("-54.10", txs.get(1).getAmount());
        assertAmount("-30.00", txs.get(2).getAmount());
    }

    @Test
    void keepsParenthesizedAmountsNegative() {
        String csv = """
                date,description,amount
                2024-03-01,Electric Co,(45.00)
                """;

        assertAmount("-45.00", parser.parse(utf8(csv)).transactions().get(0).getAmount());
    }

    @Test
    void carriesProvidedCategory() {
        String csv = """
                date,description,amount,category
                2024-03-01,Corner Shop,-5.00,food
                2024-03-02,Mystery,-7.00,
                """;

        List<Transaction> txs = parser.parse(utf8(csv)).transactions();

        assertEquals("food", txs.get(0).getSourceCategory());
        assertNull(txs.get(1).getSourceCategory());
    }

    @Test
    void reportsMissingColumnsWithHeadersFound() {
        String csv = """
                date,memo_text,value
                2024-01-01,Coffee,-3.00
                """;

        MissingColumnsException ex = assertThrows(MissingColumnsException.class, () -> parser.parse(utf8(csv)));

        assertEquals(List.of("description", "amount"), ex.getMissingFields());
        assertEquals(List.of("date", "memo_text", "value"), ex.getHeadersFound());
    }

    @Test
    void skipsBadRowsAndCountsThemByReason() {
        String csv = """
                date,description,amount
                not-a-date,Coffee,-3.00
                2024-01-02,Lunch,abc
                2024-01-03,Nothing,0.00
                2024-01-04,,-9.00
                2024-01-05,Books,-18.40
                """;

        ParsedStatement parsed = parser.parse(utf8(csv));

        assertEquals(1, parsed.transactions().size());
        Transaction tx = parsed.transactions().get(0);
        assertEquals("Books", tx.getDescription());
        assertEquals(4, tx.getRowIndex());

        assertEquals(5, parsed.diagnostics().getRowsRead());
        assertEquals(1, parsed.diagnostics().getRowsAccepted());
        assertEquals(1, parsed.diagnostics().skippedCount(SkipReason.INVALID_DATE));
        assertEquals(1, parsed.diagnostics().skippedCount(SkipReason.INVALID_AMOUNT));
        assertEquals(1, parsed.diagnostics().skippedCount(SkipReason.ZERO_AMOUNT));
        assertEquals(1, parsed.diagnostics().skippedCount(SkipReason.EMPTY_DESCRIPTION));
        assertEquals(4, parsed.diagnostics().skippedTotal());
    }

    @Test
    void throwsWithDiagnosticsWhenEveryRowIsRejected() {
        String csv = """
                date,description,amount
                yesterday,Coffee,-3.00
                """;

        NoTransactionsFoundException ex = assertThrows(NoTransactionsFoundException.class, () -> parser.parse(utf8(csv)));

        assertTrue(ex.getMessage().contains("INVALID_DATE"), ex.getMessage());
    }

    @Test
    void fallsBackToLatin1() {
        byte[] bytes = "date,description,amount\n2024-01-01,Café Paris,-3.20\n".getBytes(StandardCharsets.ISO_8859_1);

        ParsedStatement parsed = parser.parse(bytes);

        assertEquals("Café Paris", parsed.transactions().get(0).getDescription());
        assertEquals("ISO-8859-1", parsed.diagnostics().getEncoding());
        assertEquals(List.of("UTF-8", "UTF-8-BOM", "ISO-8859-1"), parsed.diagnostics().getEncodingsAttempted());
    }

    @Test
    void stripsByteOrderMark() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF});
        out.write(utf8("date,description,amount\n2024-01-01,Rent,-900.00\n"));

        ParsedStatement parsed = parser.parse(out.toByteArray());

        assertEquals("UTF-8-BOM", parsed.diagnostics().getEncoding());
        assertEquals(LocalDate.of(2024, 1, 1), parsed.transactions().get(0).getDate());
    }

    @Test
    void failsWhenNoEncodingDecodesCleanly() {
        properties.setEncodings(List.of("UTF-8"));
        byte[] bytes = utf8("date,description,amount\n2024-01-01,A\u0000B,-1.00\n");

        EncodingException ex = assertThrows(EncodingException.class, () -> parser.parse(bytes));

        assertEquals(List.of("UTF-8"), ex.getEncodingsAttempted());
    }

    @Test
    void keepsCreditSignForAmountsInRupiah() {
        String csv = """
                date,description,amount
                2024-01-05,Salary Jakarta,150000 IDR
                2024-01-06,Warung Makan,-45000 IDR
                """;

        List<Transaction> txs = parser.parse(utf8(csv)).transactions();

        assertAmount("150000", txs.get(0).getAmount());
        assertEquals(TransactionType.CREDIT, txs.get(0).getType());
        assertEquals("150000 IDR", txs.get(0).getRawAmount());
        assertAmount("-45000", txs.get(1).getAmount());
        assertEquals(TransactionType.DEBIT, txs.get(1).getType());
    }

    @Test
    void rejectsFilesOverTheRowCapCountingRejectedRows() {
        pipelineProperties.setMaxRows(3);
        String csv = """
                date,description,amount
                2024-01-01,Coffee,-3.00
                not a date,Broken,-1.00
                not a date,Broken,-1.00
                not a date,Broken,-1.00
                """;

        RowLimitExceededException ex = assertThrows(RowLimitExceededException.class, () -> parser.parse(utf8(csv)));

        assertEquals(3, ex.getMaxRows());
        assertEquals(4, ex.getRowCount());
    }

    @Test
    void acceptsFilesExactlyAtTheRowCap() {
        pipelineProperties.setMaxRows(2);
        String csv = """
                date,description,amount
                2024-01-01,Coffee,-3.00
                2024-01-02,Lunch,-12.00
                """;

        assertEquals(2, parser.parse(utf8(csv)).transactions().size());
    }

    @Test
    void sniffDelimiterPrefersCommaOnTies() {
        assertEquals(',', CsvStatementParser.sniffDelimiter("a,b;c"));
        assertEquals(';', CsvStatementParser.sniffDelimiter("a;b;c,d"));
        assertEquals('\t', CsvStatementParser.sniffDelimiter("a\tb\tc"));
        assertEquals(',', CsvStatementParser.sniffDelimiter("\"a;b;c\",d"));
    }
}
