package com.finlens.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate used by the exchange rate client.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, CurrencyProperties currencyProperties) {
        Duration timeout = currencyProperties != null ? currencyProperties.getFetchTimeout() : null;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(10);

        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
