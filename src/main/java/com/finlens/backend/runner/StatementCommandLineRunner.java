package com.finlens.backend.runner;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.finlens.backend.dto.BudgetAlert;
import com.finlens.backend.dto.BudgetReport;
import com.finlens.backend.dto.CategorySpending;
import com.finlens.backend.dto.ProcessingOptions;
import com.finlens.backend.dto.SpendingAnalysis;
import com.finlens.backend.dto.StatementProcessingResult;
import com.finlens.backend.services.budget.BudgetAnalysisService;
import com.finlens.backend.services.currency.CurrencyFormatter;
import com.finlens.backend.services.export.TransactionCsvExporter;
import com.finlens.backend.services.statements.StatementProcessingService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Batch entry point: {@code --statement=<file> [--export=<file>] [--currency=<ISO>]}.
 * Does nothing when no statement is given.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatementCommandLineRunner implements ApplicationRunner {

    private final StatementProcessingService statementProcessingService;
    private final BudgetAnalysisService budgetAnalysisService;
    private final TransactionCsvExporter transactionCsvExporter;

    @Override
    public void run(ApplicationArguments args) {
        String statement = single(args, "statement");
        if (statement == null) {
            log.debug("[StatementRunner] no --statement argument; nothing to do");
            return;
        }

        Path path = Path.of(statement);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read statement " + path, e);
        }

        ProcessingOptions options = ProcessingOptions.builder()
                .targetCurrency(single(args, "currency"))
                .listener(progress -> log.debug("[StatementRunner] chunk {}/{} {}",
                        progress.chunkIndex() + 1, progress.totalChunks(), progress.status()))
                .build();

        StatementProcessingResult result = statementProcessingService.process(bytes, path.getFileName().toString(), options);
        SpendingAnalysis analysis = budgetAnalysisService.analyzeSpending(result.transactions());
        BudgetReport report = budgetAnalysisService.recommend(result.transactions());

        String currency = result.primaryCurrency();
        log.info("[StatementRunner] {} transactions, primary currency {}", result.transactions().size(), currency);
        log.info("[StatementRunner] expenses={} income={} avgDaily={}",
                CurrencyFormatter.format(analysis.totalExpenses(), currency),
                CurrencyFormatter.format(analysis.totalIncome(), currency),
                CurrencyFormatter.format(analysis.averageDailyExpense(), currency));
        for (CategorySpending spending : analysis.categoryBreakdown()) {
            log.info("[StatementRunner]   {} {} ({}%)", spending.category().getCode(),
                    CurrencyFormatter.format(spending.total(), currency), spending.percentageOfExpenses());
        }
        report.monthlyIncomeEstimate().ifPresentOrElse(
                income -> log.info("[StatementRunner] estimated monthly income {}", CurrencyFormatter.format(income, currency)),
                () -> log.info("[StatementRunner] no income found; budget recommendations skipped"));
        for (BudgetAlert alert : report.alerts()) {
            log.info("[StatementRunner] [{}] {}: {}", alert.severity().getCode(), alert.category(), alert.message());
        }

        String export = single(args, "export");
        if (export != null) {
            Path out = Path.of(export);
            try (OutputStream os = Files.newOutputStream(out)) {
                transactionCsvExporter.export(result.transactions(), os);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write export " + out, e);
            }
            log.info("[StatementRunner] exported {} transactions to {}", result.transactions().size(), out);
        }
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
