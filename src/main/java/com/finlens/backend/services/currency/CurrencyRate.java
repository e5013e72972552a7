package com.finlens.backend.services.currency;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;

/**
 * One unit of {@code base} is worth {@code rate} units of {@code quote}.
 */
public record CurrencyRate(String base, String quote, BigDecimal rate, Instant fetchedAt, Duration ttl) {

    public CurrencyRate {
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("rate must be positive");
        }
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(fetchedAt.plus(ttl));
    }

    public CurrencyRate inverse() {
        return new CurrencyRate(quote, base, BigDecimal.ONE.divide(rate, MathContext.DECIMAL64), fetchedAt, ttl);
    }
}
