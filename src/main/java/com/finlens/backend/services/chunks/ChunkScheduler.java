package com.finlens.backend.services.chunks;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.finlens.backend.classification.CategorizationService;
import com.finlens.backend.config.PipelineProperties;
import com.finlens.backend.dto.ProcessingOptions;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.ChunkStatus;
import com.finlens.backend.exceptions.RowLimitExceededException;
import com.finlens.backend.services.currency.CurrencyConverter;
import com.finlens.backend.services.currency.CurrencyDetector;

import lombok.extern.slf4j.Slf4j;

/**
 * Splits a batch into fixed-size chunks and enriches each chunk (currency, category, optional conversion) on
 * the bounded chunk executor. Output order always equals input order.
 */
@Service
@Slf4j
public class ChunkScheduler {

    private final CurrencyDetector currencyDetector;
    private final CategorizationService categorizationService;
    private final CurrencyConverter currencyConverter;
    private final PipelineProperties pipelineProperties;
    private final Executor statementChunkTaskExecutor;

    public ChunkScheduler(
            CurrencyDetector currencyDetector,
            CategorizationService categorizationService,
            CurrencyConverter currencyConverter,
            PipelineProperties pipelineProperties,
            @Qualifier("statementChunkTaskExecutor") Executor statementChunkTaskExecutor
    ) {
        this.currencyDetector = currencyDetector;
        this.categorizationService = categorizationService;
        this.currencyConverter = currencyConverter;
        this.pipelineProperties = pipelineProperties;
        this.statementChunkTaskExecutor = statementChunkTaskExecutor;
    }

    /**
     * @throws RowLimitExceededException when the batch exceeds the row cap; nothing is processed
     * @throws CancellationException when cancellation was requested before every chunk started
     */
    public ChunkResult process(List<Transaction> transactions, ProcessingOptions options) {
        int maxRows = pipelineProperties.getMaxRows();
        if (transactions.size() > maxRows) {
            throw new RowLimitExceededException(transactions.size(), maxRows);
        }
        if (transactions.isEmpty()) {
            return new ChunkResult(List.of(), List.of());
        }

        List<List<Transaction>> chunks = partition(transactions, Math.max(1, pipelineProperties.getChunkSize()));
        int total = chunks.size();
        ChunkProgressListener listener = options.getListener() != null ? options.getListener() : ChunkProgressListener.NONE;

        log.info("[ChunkScheduler] rows={} chunks={} chunkSize={} targetCurrency={}",
                transactions.size(), total, pipelineProperties.getChunkSize(), options.getTargetCurrency());

        for (int i = 0; i < total; i++) {
            listener.onProgress(new ChunkProgress(i, total, ChunkStatus.QUEUED, chunks.get(i).size()));
        }

        // Pairs whose rate could not be obtained are not retried for the rest of the batch.
        Set<String> unavailablePairs = ConcurrentHashMap.newKeySet();

        List<CompletableFuture<ChunkOutcome>> futures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            final int index = i;
            final List<Transaction> chunk = chunks.get(i);
            futures.add(CompletableFuture.supplyAsync(
                    () -> runChunk(index, total, chunk, options, listener, unavailablePairs), statementChunkTaskExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) throw runtime;
            if (cause instanceof Error error) throw error;
            throw e;
        }

        ChunkOutcome[] outcomes = new ChunkOutcome[total];
        for (CompletableFuture<ChunkOutcome> future : futures) {
            ChunkOutcome outcome = future.join();
            outcomes[outcome.index()] = outcome;
        }

        int skipped = 0;
        List<Transaction> ordered = new ArrayList<>(transactions.size());
        Set<String> warnings = new LinkedHashSet<>();
        for (ChunkOutcome outcome : outcomes) {
            if (outcome.cancelled()) {
                skipped++;
                continue;
            }
            ordered.addAll(outcome.transactions());
            warnings.addAll(outcome.warnings());
        }

        if (skipped > 0) {
            log.info("[ChunkScheduler] cancelled; {} of {} chunks were not started", skipped, total);
            throw new CancellationException("Statement processing cancelled; " + skipped + " of " + total + " chunks not processed");
        }

        return new ChunkResult(ordered, new ArrayList<>(warnings));
    }

    private ChunkOutcome runChunk(int index, int total, List<Transaction> chunk, ProcessingOptions options,
                                  ChunkProgressListener listener, Set<String> unavailablePairs) {
        if (options.isCancelled()) {
            return ChunkOutcome.cancelled(index);
        }

        listener.onProgress(new ChunkProgress(index, total, ChunkStatus.PROCESSING, chunk.size()));

        String target = options.getTargetCurrency() == null || options.getTargetCurrency().isBlank()
                ? null
                : options.getTargetCurrency().trim().toUpperCase(Locale.ROOT);
        Set<String> warnings = new LinkedHashSet<>();
        for (Transaction tx : chunk) {
            currencyDetector.assign(tx);
            categorizationService.categorize(tx);
            if (target != null) {
                String source = tx.getCurrency();
                String pair = source + "->" + target;
                boolean converted = !unavailablePairs.contains(pair) && currencyConverter.convertTransaction(tx, target);
                if (!converted) {
                    unavailablePairs.add(pair);
                    warnings.add("Exchange rate " + pair + " unavailable; amounts kept in " + source);
                }
            }
        }

        listener.onProgress(new ChunkProgress(index, total, ChunkStatus.DONE, chunk.size()));
        log.debug("[ChunkScheduler] chunk {}/{} done rows={}", index + 1, total, chunk.size());
        return new ChunkOutcome(index, chunk, List.copyOf(warnings), false);
    }

    static List<List<Transaction>> partition(List<Transaction> transactions, int chunkSize) {
        List<List<Transaction>> chunks = new ArrayList<>();
        for (int start = 0; start < transactions.size(); start += chunkSize) {
            int end = Math.min(start + chunkSize, transactions.size());
            chunks.add(List.copyOf(transactions.subList(start, end)));
        }
        return chunks;
    }

    private record ChunkOutcome(int index, List<Transaction> transactions, List<String> warnings, boolean cancelled) {
        static ChunkOutcome cancelled(int index) {
            return new ChunkOutcome(index, List.of(), List.of(), true);
        }
    }
}
