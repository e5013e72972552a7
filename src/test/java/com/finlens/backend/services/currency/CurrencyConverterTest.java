package com.finlens.backend.services.currency;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.finlens.backend.config.CurrencyProperties;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.exceptions.RateUnavailableException;

class CurrencyConverterTest {

    private CurrencyProperties properties;
    private MutableClock clock;
    private ExchangeRateProvider provider;
    private ExecutorService executor;
    private CurrencyConverter converter;

    @BeforeEach
    void setUp() {
        properties = new CurrencyProperties();
        properties.setRateTtl(Duration.ofHours(1));
        properties.setFetchTimeout(Duration.ofMillis(300));
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        provider = mock(ExchangeRateProvider.class);
        executor = Executors.newCachedThreadPool();
        converter = new CurrencyConverter(new CaffeineExchangeRateCache(properties), provider, properties, clock, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sameCurrencyIsIdentityWithoutProviderCall() {
        assertEquals(BigDecimal.ONE, converter.getRate("usd", "USD"));
        verifyNoInteractions(provider);
    }

    @Test
    void convertsAndServesRepeatCallsFromCache() {
        when(provider.getRate("EUR", "USD")).thenReturn(new BigDecimal("1.10"));

        assertEquals(new BigDecimal("110.00"), converter.convert(new BigDecimal("100"), "EUR", "USD"));
        assertEquals(new BigDecimal("55.00"), converter.convert(new BigDecimal("50"), "EUR", "USD"));

        verify(provider, times(1)).getRate("EUR", "USD");
    }

    @Test
    void servesInverseOfCachedRate() {
        when(provider.getRate("EUR", "USD")).thenReturn(new BigDecimal("1.10"));
        converter.getRate("EUR", "USD");

        assertEquals(new BigDecimal("100.00"), converter.convert(new BigDecimal("110.00"), "USD", "EUR"));

        verify(provider, never()).getRate("USD", "EUR");
    }

    @Test
    void refetchesOnceTheRateHasExpired() {
        when(provider.getRate("EUR", "USD"))
                .thenReturn(new BigDecimal("1.10"))
                .thenReturn(new BigDecimal("1.20"));

        assertEquals(new BigDecimal("1.10"), converter.getRate("EUR", "USD"));
        clock.advance(Duration.ofMinutes(59));
        assertEquals(new BigDecimal("1.10"), converter.getRate("EUR", "USD"));
        clock.advance(Duration.ofMinutes(1));
        assertEquals(new BigDecimal("1.20"), converter.getRate("EUR", "USD"));

        verify(provider, times(2)).getRate("EUR", "USD");
    }

    @Test
    void neverServesExpiredRateWhenRefreshFails() {
        when(provider.getRate("EUR", "USD"))
                .thenReturn(new BigDecimal("1.10"))
                .thenThrow(new RateUnavailableException("EUR", "USD", "provider down"));

        converter.getRate("EUR", "USD");
        clock.advance(Duration.ofHours(2));

        assertThrows(RateUnavailableException.class, () -> converter.getRate("EUR", "USD"));
    }

    @Test
    void slowProviderCountsAsUnavailable() {
        doAnswer(invocation -> {
            Thread.sleep(3_000);
            return new BigDecimal("1.10");
        }).when(provider).getRate(anyString(), anyString());

        long started = System.nanoTime();
        RateUnavailableException ex = assertThrows(RateUnavailableException.class, () -> converter.getRate("EUR", "USD"));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertTrue(ex.getMessage().contains("timed out"), ex.getMessage());
        assertTrue(elapsedMillis < 2_500, "took " + elapsedMillis + "ms");
    }

    @Test
    void unexpectedProviderFailureIsWrapped() {
        when(provider.getRate("EUR", "USD")).thenThrow(new IllegalStateException("boom"));

        RateUnavailableException ex = assertThrows(RateUnavailableException.class, () -> converter.getRate("EUR", "USD"));

        assertEquals("EUR", ex.getBase());
        assertEquals("USD", ex.getQuote());
    }

    @Test
    void convertTransactionKeepsOriginalValues() {
        when(provider.getRate("EUR", "USD")).thenReturn(new BigDecimal("1.10"));
        Transaction tx = Transaction.builder().rowIndex(3).amount(new BigDecimal("-20.00")).currency("EUR").build();

        assertTrue(converter.convertTransaction(tx, "USD"));

        assertEquals(new BigDecimal("-22.00"), tx.getAmount());
        assertEquals("USD", tx.getCurrency());
        assertEquals(new BigDecimal("-20.00"), tx.getOriginalAmount());
        assertEquals("EUR", tx.getOriginalCurrency());
        assertEquals(new BigDecimal("1.10"), tx.getConversionRate());
    }

    @Test
    void convertTransactionLeavesRowUntouchedWhenRateMissing() {
        when(provider.getRate("EUR", "USD")).thenThrow(new RateUnavailableException("EUR", "USD", "down"));
        Transaction tx = Transaction.builder().amount(new BigDecimal("-20.00")).currency("EUR").build();

        assertFalse(converter.convertTransaction(tx, "USD"));

        assertEquals(new BigDecimal("-20.00"), tx.getAmount());
        assertEquals("EUR", tx.getCurrency());
        assertNull(tx.getOriginalCurrency());
    }

    @Test
    void convertTransactionInTargetCurrencyIsNoop() {
        Transaction tx = Transaction.builder().amount(new BigDecimal("-20.00")).currency("USD").build();

        assertTrue(converter.convertTransaction(tx, "usd"));

        assertNull(tx.getOriginalAmount());
        verifyNoInteractions(provider);
    }
}
