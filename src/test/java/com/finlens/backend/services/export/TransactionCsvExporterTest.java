package com.finlens.backend.services.export;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.finlens.backend.config.CsvProperties;
import com.finlens.backend.config.PipelineProperties;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.TransactionCategory;
import com.finlens.backend.enums.TransactionType;
import com.finlens.backend.services.statements.csv.CsvStatementParser;

class TransactionCsvExporterTest {

    private final TransactionCsvExporter exporter = new TransactionCsvExporter();

    private static List<Transaction> sample() {
        return List.of(
                Transaction.builder()
                        .rowIndex(0)
                        .date(LocalDate.of(2024, 1, 5))
                        .description("Starbucks, Main St")
                        .amount(new BigDecimal("-4.50"))
                        .currency("USD")
                        .category(TransactionCategory.FOOD)
                        .type(TransactionType.DEBIT)
                        .build(),
                Transaction.builder()
                        .rowIndex(1)
                        .date(LocalDate.of(2024, 1, 31))
                        .description("Payroll")
                        .amount(new BigDecimal("2500.00"))
                        .currency("USD")
                        .category(TransactionCategory.OTHER)
                        .type(TransactionType.CREDIT)
                        .build());
    }

    @Test
    void writesCanonicalColumnsInOrder() {
        String csv = exporter.export(sample());

        assertEquals("""
                date,description,amount,currency,category,type
                2024-01-05,"Starbucks, Main St",-4.50,USD,food,debit
                2024-01-31,Payroll,2500.00,USD,other,credit
                """, csv);
    }

    @Test
    void writesUtf8ToStream() {
        Transaction tx = Transaction.builder()
                .date(LocalDate.of(2024, 2, 1))
                .description("Café Crème")
                .amount(new BigDecimal("-3.20"))
                .currency("EUR")
                .category(TransactionCategory.FOOD)
                .type(TransactionType.DEBIT)
                .build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        exporter.export(List.of(tx), out);

        assertEquals("date,description,amount,currency,category,type\n2024-02-01,Café Crème,-3.20,EUR,food,debit\n",
                out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void exportedCsvParsesBackToSameRows() {
        List<Transaction> original = sample();
        byte[] exported = exporter.export(original).getBytes(StandardCharsets.UTF_8);

        List<Transaction> parsed = new CsvStatementParser(new CsvProperties(), new PipelineProperties()).parse(exported).transactions();

        assertEquals(original.size(), parsed.size());
        for (int i = 0; i < original.size(); i++) {
            assertEquals(original.get(i).getDate(), parsed.get(i).getDate());
            assertEquals(original.get(i).getDescription(), parsed.get(i).getDescription());
            assertEquals(0, original.get(i).getAmount().compareTo(parsed.get(i).getAmount()));
            assertEquals(original.get(i).getCurrency(), parsed.get(i).getSourceCurrency());
            assertEquals(original.get(i).getCategory().getCode(), parsed.get(i).getSourceCategory());
        }
    }
}
