package com.finlens.backend.services.chunks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.finlens.backend.classification.CategorizationService;
import com.finlens.backend.config.ClassificationProperties;
import com.finlens.backend.config.CurrencyProperties;
import com.finlens.backend.config.PipelineProperties;
import com.finlens.backend.dto.ProcessingOptions;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.ChunkStatus;
import com.finlens.backend.enums.TransactionCategory;
import com.finlens.backend.exceptions.RowLimitExceededException;
import com.finlens.backend.services.currency.CurrencyConverter;
import com.finlens.backend.services.currency.CurrencyDetector;

class ChunkSchedulerTest {

    private static final List<String> DESCRIPTIONS = List.of("Starbucks", "Uber", "Netflix", "Amazon", "Unknown Vendor");

    private PipelineProperties pipelineProperties;
    private CurrencyDetector currencyDetector;
    private CategorizationService categorizationService;
    private CurrencyConverter currencyConverter;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        pipelineProperties = new PipelineProperties();
        currencyDetector = new CurrencyDetector(new CurrencyProperties());
        categorizationService = CategorizationService.ruleOnly(new ClassificationProperties());
        currencyConverter = mock(CurrencyConverter.class);
        executor = newExecutor(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static ThreadPoolTaskExecutor newExecutor(int threads) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(threads);
        ex.setMaxPoolSize(threads);
        ex.setQueueCapacity(20_000);
        ex.setThreadNamePrefix("test-chunk-");
        ex.initialize();
        return ex;
    }

    private ChunkScheduler scheduler() {
        return new ChunkScheduler(currencyDetector, categorizationService, currencyConverter, pipelineProperties, executor);
    }

    private static List<Transaction> transactions(int count) {
        List<Transaction> txs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            txs.add(Transaction.builder()
                    .rowIndex(i)
                    .date(LocalDate.of(2024, 1, 1).plusDays(i % 28))
                    .description(DESCRIPTIONS.get(i % DESCRIPTIONS.size()))
                    .amount(new BigDecimal("-" + (i % 50 + 1) + ".00"))
                    .rawAmount("$" + (i % 50 + 1) + ".00")
                    .build());
        }
        return txs;
    }

    @Test
    void preservesInputOrderForAnyChunkSize() {
        for (int chunkSize : new int[] {1, 7, 1000, 5000}) {
            pipelineProperties.setChunkSize(chunkSize);

            ChunkResult result = scheduler().process(transactions(2_500), ProcessingOptions.defaults());

            assertEquals(2_500, result.transactions().size());
            for (int i = 0; i < 2_500; i++) {
                assertEquals(i, result.transactions().get(i).getRowIndex(), "chunkSize=" + chunkSize);
            }
        }
    }

    @Test
    void categoriesDoNotDependOnChunkSize() {
        List<String> descriptions = List.of("Starbucks Coffee", "Shell gas station", "Netflix subscription",
                "Amazon Marketplace", "Unknown Vendor", "CVS Pharmacy", "Marriott hotel", "Verizon bill",
                "Udemy course", "Geico premium", "Vanguard fund", "Pizza and movie night");

        pipelineProperties.setChunkSize(1);
        List<Transaction> baseline = scheduler().process(varied(descriptions, 2_500), ProcessingOptions.defaults())
                .transactions();

        for (int chunkSize : new int[] {7, 1000, 5000}) {
            pipelineProperties.setChunkSize(chunkSize);

            List<Transaction> result = scheduler().process(varied(descriptions, 2_500), ProcessingOptions.defaults())
                    .transactions();

            assertEquals(baseline.size(), result.size());
            for (int i = 0; i < baseline.size(); i++) {
                Transaction expected = baseline.get(i);
                Transaction actual = result.get(i);
                String row = "chunkSize=" + chunkSize + " row=" + i;
                assertEquals(expected.getCategory(), actual.getCategory(), row);
                assertEquals(expected.getConfidence(), actual.getConfidence(), row);
                assertEquals(expected.getCurrency(), actual.getCurrency(), row);
            }
        }
        assertEquals(TransactionCategory.FOOD, baseline.get(0).getCategory());
        assertEquals(TransactionCategory.SHOPPING, baseline.get(3).getCategory());
        assertEquals(TransactionCategory.OTHER, baseline.get(4).getCategory());
    }

    private static List<Transaction> varied(List<String> descriptions, int count) {
        List<Transaction> txs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            txs.add(Transaction.builder()
                    .rowIndex(i)
                    .date(LocalDate.of(2024, 3, 1).plusDays(i % 30))
                    .description(descriptions.get(i % descriptions.size()))
                    .amount(new BigDecimal("-" + (i % 90 + 1) + ".25"))
                    .rawAmount(i % 3 == 0 ? "€" + (i % 90 + 1) + ",25" : "$" + (i % 90 + 1) + ".25")
                    .sourceCategory(i % 11 == 5 ? "travel" : null)
                    .build());
        }
        return txs;
    }

    @Test
    void enrichesEveryTransaction() {
        ChunkResult result = scheduler().process(transactions(10), ProcessingOptions.defaults());

        for (Transaction tx : result.transactions()) {
            assertEquals("USD", tx.getCurrency());
            assertNotNull(tx.getCategory());
        }
        assertEquals(TransactionCategory.FOOD, result.transactions().get(0).getCategory());
        assertEquals(TransactionCategory.OTHER, result.transactions().get(4).getCategory());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void rejectsOversizedBatchBeforeAnyWork() {
        categorizationService = mock(CategorizationService.class);
        List<ChunkProgress> events = Collections.synchronizedList(new ArrayList<>());
        ProcessingOptions options = ProcessingOptions.builder().listener(events::add).build();

        RowLimitExceededException ex = assertThrows(RowLimitExceededException.class,
                () -> scheduler().process(transactions(12_000), options));

        assertEquals(12_000, ex.getRowCount());
        assertEquals(10_000, ex.getMaxRows());
        assertTrue(events.isEmpty());
        verifyNoInteractions(categorizationService, currencyConverter);
    }

    @Test
    void acceptsBatchAtExactlyTheLimit() {
        ChunkResult result = scheduler().process(transactions(10_000), ProcessingOptions.defaults());

        assertEquals(10_000, result.transactions().size());
    }

    @Test
    void emptyBatchProducesEmptyResult() {
        ChunkResult result = scheduler().process(List.of(), ProcessingOptions.defaults());

        assertTrue(result.transactions().isEmpty());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void reportsQueuedProcessingDonePerChunk() {
        pipelineProperties.setChunkSize(100);
        List<ChunkProgress> events = Collections.synchronizedList(new ArrayList<>());
        ProcessingOptions options = ProcessingOptions.builder().listener(events::add).build();

        scheduler().process(transactions(250), options);

        assertEquals(9, events.size());
        for (int chunk = 0; chunk < 3; chunk++) {
            final int index = chunk;
            List<ChunkStatus> statuses;
            synchronized (events) {
                statuses = events.stream()
                        .filter(e -> e.chunkIndex() == index)
                        .map(ChunkProgress::status)
                        .collect(Collectors.toList());
            }
            assertEquals(List.of(ChunkStatus.QUEUED, ChunkStatus.PROCESSING, ChunkStatus.DONE), statuses);
        }
        assertEquals(3, events.get(0).totalChunks());
        assertEquals(50, events.stream().filter(e -> e.chunkIndex() == 2).findFirst().orElseThrow().rows());
    }

    @Test
    void cancellationBeforeStartProcessesNothing() {
        categorizationService = mock(CategorizationService.class);
        ProcessingOptions options = ProcessingOptions.builder().build();
        options.getCancellation().set(true);

        assertThrows(CancellationException.class, () -> scheduler().process(transactions(50), options));

        verifyNoInteractions(categorizationService);
    }

    @Test
    void cancellationStopsChunksThatHaveNotStarted() {
        executor.shutdown();
        executor = newExecutor(1);
        pipelineProperties.setChunkSize(10);
        AtomicBoolean cancel = new AtomicBoolean(false);
        ProcessingOptions options = ProcessingOptions.builder()
                .cancellation(cancel)
                .listener(progress -> {
                    if (progress.chunkIndex() == 0 && progress.status() == ChunkStatus.DONE) {
                        cancel.set(true);
                    }
                })
                .build();

        CancellationException ex = assertThrows(CancellationException.class, () -> scheduler().process(transactions(50), options));

        assertTrue(ex.getMessage().contains("4 of 5"), ex.getMessage());
    }

    @Test
    void unavailableRateIsReportedOnceAndAmountsKept() {
        pipelineProperties.setChunkSize(3);
        when(currencyConverter.convertTransaction(any(Transaction.class), eq("EUR"))).thenReturn(false);
        ProcessingOptions options = ProcessingOptions.builder().targetCurrency("eur").build();

        ChunkResult result = scheduler().process(transactions(12), options);

        assertEquals(List.of("Exchange rate USD->EUR unavailable; amounts kept in USD"), result.warnings());
        assertEquals("USD", result.transactions().get(0).getCurrency());
        assertEquals(new BigDecimal("-1.00"), result.transactions().get(0).getAmount());
    }

    @Test
    void partitionKeepsRemainderInLastChunk() {
        List<List<Transaction>> chunks = ChunkScheduler.partition(transactions(7), 3);

        assertEquals(3, chunks.size());
        assertEquals(1, chunks.get(2).size());
        assertEquals(6, chunks.get(2).get(0).getRowIndex());
    }
}
