package com.finlens.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Currency detection and conversion settings.
 *
 * finlens.currency.base-url=https://api.exchangerate.host
 * finlens.currency.access-key=${EXCHANGE_RATE_ACCESS_KEY:}
 */
@Data
@ConfigurationProperties(prefix = "finlens.currency")
public class CurrencyProperties {

    /**
     * Assigned when neither a currency column nor a symbol identifies the currency.
     */
    private String defaultCurrency = "USD";

    private Duration rateTtl = Duration.ofHours(1);

    /**
     * Upper bound on a single rate fetch; a slower provider counts as unavailable.
     */
    private Duration fetchTimeout = Duration.ofSeconds(10);

    private String baseUrl = "https://api.exchangerate.host";

    /**
     * Optional provider API key, sent as access_key when present.
     */
    private String accessKey = "";

    private long cacheMaximumSize = 1000;

    // Primary currency vote weights.
    private double frequencyWeight = 0.7;
    private double valueWeight = 0.3;
}
