package com.finlens.backend.services.currency;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.finlens.backend.config.CurrencyProperties;
import com.finlens.backend.exceptions.RateUnavailableException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * exchangerate.host client: {@code GET /convert?from=EUR&to=USD&amount=1}.
 */
@Component
@Slf4j
public class ExchangeRateHostClient implements ExchangeRateProvider {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String accessKey;

    public ExchangeRateHostClient(RestTemplate restTemplate, CurrencyProperties currencyProperties) {
        this.restTemplate = restTemplate;
        String url = currencyProperties.getBaseUrl();
        url = (url != null && !url.isBlank()) ? url.trim() : "https://api.exchangerate.host";
        if (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        this.baseUrl = url;
        this.accessKey = currencyProperties.getAccessKey();
        log.info("[ExchangeRateHostClient] Configured baseUrl={}", this.baseUrl);
    }

    @Override
    public BigDecimal getRate(String base, String quote) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/convert")
                .queryParam("from", base)
                .queryParam("to", quote)
                .queryParam("amount", 1);
        if (accessKey != null && !accessKey.isBlank()) {
            uri.queryParam("access_key", accessKey);
        }
        String url = uri.build().toUriString();

        ConvertResponse response;
        try {
            response = restTemplate.getForObject(url, ConvertResponse.class);
        } catch (HttpStatusCodeException e) {
            String payload = e.getResponseBodyAsString();
            throw new RateUnavailableException(base, quote, "provider status=" + e.getStatusCode()
                    + " body=" + (payload.length() > 300 ? payload.substring(0, 300) : payload), e);
        } catch (ResourceAccessException e) {
            throw new RateUnavailableException(base, quote, "provider unreachable: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new RateUnavailableException(base, quote, "provider returned empty body");
        }
        if (Boolean.FALSE.equals(response.success())) {
            String reason = response.error() != null ? response.error().info() : "success=false";
            throw new RateUnavailableException(base, quote, "provider error: " + reason);
        }

        BigDecimal rate = response.rate();
        if (rate == null || rate.signum() <= 0) {
            throw new RateUnavailableException(base, quote, "provider returned no usable rate");
        }
        log.debug("[ExchangeRateHostClient] {}->{} rate={}", base, quote, rate);
        return rate;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConvertResponse(Boolean success, Info info, BigDecimal result, ApiError error) {

        /**
         * Rate of a one-unit conversion: the result, else the rate reported in info.
         */
        BigDecimal rate() {
            if (result != null) return result;
            if (info == null) return null;
            return info.rate() != null ? info.rate() : info.quote();
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Info(BigDecimal rate, BigDecimal quote, Long timestamp) {
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        record ApiError(Integer code, String type, String info) {
        }
    }
}
