package com.finlens.backend.services.currency;

import java.util.Optional;

public interface ExchangeRateCache {

    /**
     * The stored rate for the exact pair, possibly already expired.
     */
    Optional<CurrencyRate> get(String base, String quote);

    void put(CurrencyRate rate);
}
