package com.finlens.backend.services.statements;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.finlens.backend.classification.CategorizationService;
import com.finlens.backend.dto.ParsedStatement;
import com.finlens.backend.dto.ProcessingOptions;
import com.finlens.backend.dto.StatementProcessingResult;
import com.finlens.backend.enums.StatementFormat;
import com.finlens.backend.services.chunks.ChunkResult;
import com.finlens.backend.services.chunks.ChunkScheduler;
import com.finlens.backend.services.currency.CurrencyConverter;
import com.finlens.backend.services.currency.CurrencyDetector;
import com.finlens.backend.services.statements.csv.CsvStatementParser;
import com.finlens.backend.services.statements.pdf.PdfStatementParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Statement pipeline entry point: detect format, parse, enrich in chunks, elect the primary currency.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementProcessingService {

    static final String CLASSIFIER_UNAVAILABLE_WARNING = "Classifier unavailable; categorized with keyword rules only";

    private final FormatDetector formatDetector;
    private final CsvStatementParser csvStatementParser;
    private final PdfStatementParser pdfStatementParser;
    private final ChunkScheduler chunkScheduler;
    private final CurrencyDetector currencyDetector;
    private final CurrencyConverter currencyConverter;
    private final CategorizationService categorizationService;

    public StatementProcessingResult process(byte[] bytes, String filename, ProcessingOptions options) {
        ProcessingOptions opts = options != null ? options : ProcessingOptions.defaults();

        StatementFormat format = formatDetector.detect(bytes, filename);
        log.info("[StatementUpload] file={} bytes={} format={}", filename, bytes.length, format);

        ParsedStatement parsed = format == StatementFormat.PDF
                ? pdfStatementParser.parse(bytes)
                : csvStatementParser.parse(bytes);

        ChunkResult chunkResult = chunkScheduler.process(parsed.transactions(), opts);
        if (opts.getTargetCurrency() != null) {
            currencyConverter.logConversionSummary(chunkResult.transactions());
        }

        String primaryCurrency = currencyDetector.electPrimary(chunkResult.transactions());

        List<String> warnings = new ArrayList<>();
        if (!categorizationService.isClassifierAvailable()) {
            warnings.add(CLASSIFIER_UNAVAILABLE_WARNING);
        }
        warnings.addAll(chunkResult.warnings());
        for (String warning : warnings) {
            log.warn("[StatementUpload] {}", warning);
        }

        log.info("[StatementUpload] processed file={} transactions={} primaryCurrency={} {}",
                filename, chunkResult.transactions().size(), primaryCurrency, parsed.diagnostics().summary());

        return new StatementProcessingResult(format, chunkResult.transactions(), primaryCurrency, parsed.diagnostics(), warnings);
    }
}
