package com.finlens.backend.services.currency;

import java.math.BigDecimal;

import com.finlens.backend.exceptions.RateUnavailableException;

/**
 * Source of live exchange rates.
 */
public interface ExchangeRateProvider {

    /**
     * @return units of {@code quote} per one unit of {@code base}
     * @throws RateUnavailableException when the provider cannot supply the rate
     */
    BigDecimal getRate(String base, String quote);
}
