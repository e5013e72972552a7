package com.finlens.backend.services.currency;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.finlens.backend.config.CurrencyProperties;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.exceptions.RateUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Converts amounts through cached rates. A rate is served from the cache (direct or inverted) while fresh;
 * otherwise it is fetched from the provider, bounded by the fetch timeout. Expired rates are never served.
 */
@Service
@Slf4j
public class CurrencyConverter {

    private static final int MONEY_SCALE = 2;

    private final ExchangeRateCache rateCache;
    private final ExchangeRateProvider rateProvider;
    private final CurrencyProperties currencyProperties;
    private final Clock clock;
    private final Executor exchangeRateTaskExecutor;

    public CurrencyConverter(
            ExchangeRateCache rateCache,
            ExchangeRateProvider rateProvider,
            CurrencyProperties currencyProperties,
            Clock clock,
            @Qualifier("exchangeRateTaskExecutor") Executor exchangeRateTaskExecutor
    ) {
        this.rateCache = rateCache;
        this.rateProvider = rateProvider;
        this.currencyProperties = currencyProperties;
        this.clock = clock;
        this.exchangeRateTaskExecutor = exchangeRateTaskExecutor;
    }

    public BigDecimal convert(BigDecimal amount, String from, String to) {
        if (amount == null) return null;
        BigDecimal rate = getRate(from, to);
        return amount.multiply(rate).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @throws RateUnavailableException when neither a fresh cached rate (direct or inverse) nor a fetched one exists
     */
    public BigDecimal getRate(String from, String to) {
        String base = code(from);
        String quote = code(to);
        if (base.equals(quote)) return BigDecimal.ONE;

        Instant now = clock.instant();

        Optional<CurrencyRate> direct = rateCache.get(base, quote);
        if (direct.isPresent() && !direct.get().isExpiredAt(now)) {
            return direct.get().rate();
        }

        Optional<CurrencyRate> inverse = rateCache.get(quote, base);
        if (inverse.isPresent() && !inverse.get().isExpiredAt(now)) {
            return inverse.get().inverse().rate();
        }

        if (direct.isPresent() || inverse.isPresent()) {
            log.debug("[CurrencyConverter] cached rate {}->{} expired, refreshing", base, quote);
        }

        BigDecimal fetched = fetchWithTimeout(base, quote);
        rateCache.put(new CurrencyRate(base, quote, fetched, clock.instant(), currencyProperties.getRateTtl()));
        return fetched;
    }

    /**
     * Converts the transaction in place, keeping the original amount and currency.
     *
     * @return false when no rate was available; the transaction is then left unconverted
     */
    public boolean convertTransaction(Transaction tx, String targetCurrency) {
        String target = code(targetCurrency);
        String source = tx.getCurrency() != null ? code(tx.getCurrency()) : target;
        if (source.equals(target)) return true;

        BigDecimal rate;
        try {
            rate = getRate(source, target);
        } catch (RateUnavailableException e) {
            log.warn("[CurrencyConverter] {}; row {} kept in {}", e.getMessage(), tx.getRowIndex(), source);
            return false;
        }

        tx.setOriginalAmount(tx.getAmount());
        tx.setOriginalCurrency(source);
        tx.setConversionRate(rate);
        tx.setAmount(tx.getAmount().multiply(rate).setScale(MONEY_SCALE, RoundingMode.HALF_UP));
        tx.setCurrency(target);
        return true;
    }

    /**
     * Logs how many rows were converted per currency pair and the totals before and after conversion.
     */
    public void logConversionSummary(List<Transaction> transactions) {
        Map<String, BigDecimal[]> byPair = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (tx.getOriginalCurrency() == null) continue;
            String pair = tx.getOriginalCurrency() + "->" + tx.getCurrency();
            BigDecimal[] totals = byPair.computeIfAbsent(pair, k -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            totals[0] = totals[0].add(tx.getOriginalAmount());
            totals[1] = totals[1].add(tx.getAmount());
            counts.merge(pair, 1, Integer::sum);
        }
        if (byPair.isEmpty()) return;

        for (Map.Entry<String, BigDecimal[]> e : byPair.entrySet()) {
            log.info("[CurrencyConverter] converted pair={} rows={} originalTotal={} convertedTotal={}",
                    e.getKey(), counts.get(e.getKey()), e.getValue()[0], e.getValue()[1]);
        }
    }

    private BigDecimal fetchWithTimeout(String base, String quote) {
        Duration timeout = currencyProperties.getFetchTimeout();
        CompletableFuture<BigDecimal> future =
                CompletableFuture.supplyAsync(() -> rateProvider.getRate(base, quote), exchangeRateTaskExecutor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RateUnavailableException(base, quote, "fetch timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RateUnavailableException rateUnavailable) {
                throw rateUnavailable;
            }
            throw new RateUnavailableException(base, quote, "fetch failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateUnavailableException(base, quote, "fetch interrupted", e);
        }
    }

    private static String code(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency is required");
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }
}
