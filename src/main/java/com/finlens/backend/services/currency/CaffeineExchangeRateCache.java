package com.finlens.backend.services.currency;

import java.time.Duration;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.finlens.backend.config.CurrencyProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Process-wide rate cache. Caffeine evicts entries after the TTL; callers still check
 * {@link CurrencyRate#isExpiredAt} against their own clock.
 */
@Component
public class CaffeineExchangeRateCache implements ExchangeRateCache {

    private final Cache<String, CurrencyRate> cache;

    public CaffeineExchangeRateCache(CurrencyProperties currencyProperties) {
        Duration ttl = currencyProperties.getRateTtl();
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(currencyProperties.getCacheMaximumSize())
                .build();
    }

    @Override
    public Optional<CurrencyRate> get(String base, String quote) {
        return Optional.ofNullable(cache.getIfPresent(key(base, quote)));
    }

    @Override
    public void put(CurrencyRate rate) {
        cache.put(key(rate.base(), rate.quote()), rate);
    }

    private static String key(String base, String quote) {
        return base + "/" + quote;
    }
}
