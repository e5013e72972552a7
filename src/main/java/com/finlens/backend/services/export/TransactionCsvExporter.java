package com.finlens.backend.services.export;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import com.finlens.backend.dto.Transaction;

/**
 * Writes the canonical CSV: {@code date,description,amount,currency,category,type}, one row per transaction in
 * sequence order.
 */
@Component
public class TransactionCsvExporter {

    public static final String[] HEADER = {"date", "description", "amount", "currency", "category", "type"};

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator("\n")
            .build();

    public String export(List<Transaction> transactions) {
        StringWriter out = new StringWriter();
        write(transactions, out);
        return out.toString();
    }

    public void export(List<Transaction> transactions, OutputStream outputStream) {
        Writer writer = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
        write(transactions, writer);
    }

    private void write(List<Transaction> transactions, Writer writer) {
        try {
            CSVPrinter printer = new CSVPrinter(writer, FORMAT);
            for (Transaction tx : transactions) {
                printer.printRecord(
                        tx.getDate() == null ? "" : tx.getDate().format(DateTimeFormatter.ISO_LOCAL_DATE),
                        tx.getDescription(),
                        tx.getAmount() == null ? "" : tx.getAmount().toPlainString(),
                        tx.getCurrency(),
                        tx.getCategory() == null ? "" : tx.getCategory().getCode(),
                        tx.getType() == null ? "" : tx.getType().getCode());
            }
            printer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write transaction CSV", e);
        }
    }
}
